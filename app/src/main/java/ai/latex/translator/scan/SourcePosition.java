package ai.latex.translator.scan;

/**
 * Location of a token. Lines and columns are 1-based, the offset is 0-based.
 */
public record SourcePosition(int offset, int line, int column) {

    public SourcePosition {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based");
        }
    }
}
