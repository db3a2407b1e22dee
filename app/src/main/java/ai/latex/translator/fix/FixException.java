package ai.latex.translator.fix;

/**
 * I/O failure while backing up, writing or restoring a document. Fails only the current attempt.
 */
public class FixException extends RuntimeException {

    public FixException(String message, Throwable cause) {
        super(message, cause);
    }

    public FixException(String message) {
        super(message);
    }
}
