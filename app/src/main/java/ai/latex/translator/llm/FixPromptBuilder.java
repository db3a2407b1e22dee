package ai.latex.translator.llm;

import ai.latex.translator.validate.SyntaxError;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the single user message sent to the chat model: repair rules, the literal issue list and
 * the full document.
 */
public final class FixPromptBuilder {

    private FixPromptBuilder() {
    }

    public static String build(String content, List<SyntaxError> errors) {
        String issues = errors.stream()
                .map(FixPromptBuilder::describe)
                .collect(Collectors.joining("\n"));
        return """
You repair LaTeX syntax. The document below fails structural validation.
Rules:
- Fix only the listed problems: unbalanced braces, brackets, math delimiters and environments.
- Do not translate, rephrase or reorder any prose. Keep comments, blank lines and line breaks.
- Do not add packages, commands or explanations.
- Output only the corrected LaTeX source, without code fences.

Problems:
""" + issues + """


<latex>
""" + content + "\n</latex>";
    }

    static String describe(SyntaxError error) {
        return "- Line " + error.line() + ", Column " + error.column() + ": " + error.message()
                + " (Type: " + error.type().label() + ")";
    }
}
