package mutant.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable AST value: a type tag, the source position it was read from and the
 * ordered children described by the type's slot schema. Children are other nodes,
 * lists of nodes, scalars ({@link String}, {@link Boolean}, {@link Long}) or
 * {@code null} for an absent optional node.
 *
 * <p>Equality is structural and includes the position, so two nodes are equal
 * exactly when their {@linkplain #canonicalForm() canonical forms} are.
 */
public final class Node {

    private final NodeType type;
    private final SourcePosition position;
    private final List<Object> children;
    private int hash;

    public Node(NodeType type, SourcePosition position, List<?> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.position = Objects.requireNonNull(position, "position");
        Objects.requireNonNull(children, "children");
        if (children.size() != type.arity()) {
            throw new IllegalArgumentException(String.format(
                    "%s expects %d children %s but got %d",
                    type, type.arity(), type.slots(), children.size()));
        }
        List<Object> copy = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Slot slot = type.slots().get(i);
            Object child = children.get(i);
            if (!slot.accepts(child)) {
                throw new IllegalArgumentException(String.format(
                        "%s slot '%s' (%s) cannot hold %s",
                        type, slot.name(), slot.kind(), describe(child)));
            }
            copy.add(child instanceof List<?> list ? List.copyOf(list) : child);
        }
        this.children = Collections.unmodifiableList(copy);
    }

    public static Node of(NodeType type, SourcePosition position, Object... children) {
        return new Node(type, position, Arrays.asList(children));
    }

    public NodeType type() {
        return type;
    }

    public SourcePosition position() {
        return position;
    }

    /** Ordered children; lists inside are unmodifiable. */
    public List<Object> children() {
        return children;
    }

    public Object child(int index) {
        return children.get(index);
    }

    public Object get(String slotName) {
        return children.get(slotIndex(slotName));
    }

    public Node node(String slotName) {
        return (Node) get(slotName);
    }

    @SuppressWarnings("unchecked")
    public List<Node> nodes(String slotName) {
        return (List<Node>) get(slotName);
    }

    public String string(String slotName) {
        return (String) get(slotName);
    }

    public boolean bool(String slotName) {
        return (Boolean) get(slotName);
    }

    public long number(String slotName) {
        return (Long) get(slotName);
    }

    /** Children of the list slot, or an empty list when the type has none. */
    @SuppressWarnings("unchecked")
    public List<Node> elements() {
        int index = type.listSlotIndex();
        return index == -1 ? List.of() : (List<Node>) children.get(index);
    }

    private int slotIndex(String slotName) {
        int index = type.indexOf(slotName);
        if (index == -1) {
            throw new IllegalArgumentException(type + " has no slot '" + slotName + "'");
        }
        return index;
    }

    /**
     * Copy of this tree in which every node is a fresh instance. Scalars are
     * immutable and shared.
     */
    public Node deepCopy() {
        List<Object> copied = new ArrayList<>(children.size());
        for (Object child : children) {
            copied.add(copyChild(child));
        }
        return new Node(type, position, copied);
    }

    private static Object copyChild(Object child) {
        if (child instanceof Node node) {
            return node.deepCopy();
        }
        if (child instanceof List<?> list) {
            List<Node> copied = new ArrayList<>(list.size());
            for (Object element : list) {
                copied.add(((Node) element).deepCopy());
            }
            return copied;
        }
        return child;
    }

    /**
     * Order preserving structural projection: type name, position, then the
     * projection of every child. Lists project element-wise, scalars and absent
     * children as themselves.
     */
    public List<Object> canonicalForm() {
        List<Object> form = new ArrayList<>(children.size() + 2);
        form.add(type.name());
        form.add(position);
        for (Object child : children) {
            form.add(project(child));
        }
        return Collections.unmodifiableList(form);
    }

    private static Object project(Object child) {
        if (child instanceof Node node) {
            return node.canonicalForm();
        }
        if (child instanceof List<?> list) {
            List<Object> projected = new ArrayList<>(list.size());
            for (Object element : list) {
                projected.add(((Node) element).canonicalForm());
            }
            return Collections.unmodifiableList(projected);
        }
        return child;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return type == other.type
                && position.equals(other.position)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(type, position, children);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendSexp(sb, this);
        return sb.toString();
    }

    private static void appendSexp(StringBuilder sb, Object value) {
        if (value instanceof Node node) {
            sb.append('(').append(node.type.name().toLowerCase(java.util.Locale.ROOT));
            for (Object child : node.children) {
                sb.append(' ');
                appendSexp(sb, child);
            }
            sb.append(')');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                appendSexp(sb, list.get(i));
            }
            sb.append(']');
        } else if (value instanceof String s) {
            sb.append('"').append(s).append('"');
        } else {
            sb.append(value);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    /**
     * Mutable shallow copy of a node: children are shared by reference until a
     * slot is replaced. {@link #build()} produces a new immutable node at the same
     * position.
     */
    public static final class Builder {
        private final NodeType type;
        private final SourcePosition position;
        private final List<Object> children;

        private Builder(Node original) {
            this.type = original.type;
            this.position = original.position;
            this.children = new ArrayList<>(original.children);
        }

        public NodeType type() {
            return type;
        }

        public Builder set(String slotName, Object value) {
            int index = type.indexOf(slotName);
            if (index == -1) {
                throw new IllegalArgumentException(type + " has no slot '" + slotName + "'");
            }
            return set(index, value);
        }

        public Builder set(int index, Object value) {
            children.set(index, value);
            return this;
        }

        public Node build() {
            return new Node(type, position, children);
        }
    }
}
