package mutant.ast;

/**
 * Line and column of a node in its source file, both 1-based.
 */
public record SourcePosition(int line, int column) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("negative source position " + line + ":" + column);
        }
    }

    public static SourcePosition line(int line) {
        return new SourcePosition(line, 0);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
