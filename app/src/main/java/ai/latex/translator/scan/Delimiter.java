package ai.latex.translator.scan;

/**
 * Paired delimiter classes tracked by the scanner. Each class is balanced independently.
 */
public enum Delimiter {
    BRACE("{", "}"),
    BRACKET("[", "]"),
    PAREN_MATH("\\(", "\\)"),
    BRACKET_MATH("\\[", "\\]");

    private final String opening;
    private final String closing;

    Delimiter(String opening, String closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public String opening() {
        return opening;
    }

    public String closing() {
        return closing;
    }
}
