package ai.latex.translator.llm;

/**
 * Base failure raised by the LLM fixer.
 */
public class LlmFixException extends RuntimeException {

    public LlmFixException(String message) {
        super(message);
    }

    public LlmFixException(String message, Throwable cause) {
        super(message, cause);
    }
}
