package ai.latex.translator.llm;

import java.util.OptionalInt;

/**
 * The chat model endpoint rejected the request or could not be reached.
 */
public class ApiCallException extends LlmFixException {

    private final OptionalInt statusCode;
    private final boolean retryable;

    public ApiCallException(String message, OptionalInt statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode == null ? OptionalInt.empty() : statusCode;
        this.retryable = retryable;
    }

    public OptionalInt statusCode() {
        return statusCode;
    }

    public boolean retryable() {
        return retryable;
    }
}
