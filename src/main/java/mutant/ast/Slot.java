package mutant.ast;

import java.util.Objects;

/**
 * Named child position of a {@link NodeType}.
 */
public record Slot(String name, Kind kind) {

    public enum Kind {
        NODE,
        OPTIONAL_NODE,
        NODE_LIST,
        SCALAR
    }

    public Slot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    static Slot node(String name) {
        return new Slot(name, Kind.NODE);
    }

    static Slot optional(String name) {
        return new Slot(name, Kind.OPTIONAL_NODE);
    }

    static Slot list(String name) {
        return new Slot(name, Kind.NODE_LIST);
    }

    static Slot scalar(String name) {
        return new Slot(name, Kind.SCALAR);
    }

    boolean accepts(Object value) {
        switch (kind) {
            case NODE:
                return value instanceof Node;
            case OPTIONAL_NODE:
                return value == null || value instanceof Node;
            case NODE_LIST:
                if (!(value instanceof java.util.List<?> list)) {
                    return false;
                }
                for (Object element : list) {
                    if (!(element instanceof Node)) {
                        return false;
                    }
                }
                return true;
            case SCALAR:
                return value instanceof String || value instanceof Boolean || value instanceof Long;
            default:
                return false;
        }
    }
}
