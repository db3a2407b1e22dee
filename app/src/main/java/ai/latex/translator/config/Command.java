package ai.latex.translator.config;

import java.util.Locale;

/**
 * Top level operations exposed by the command line.
 */
public enum Command {
    VALIDATE,
    REPAIR,
    COMPLETENESS;

    public static Command from(String value) {
        if (value == null) {
            return VALIDATE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "validate", "" -> VALIDATE;
            case "repair", "fix" -> REPAIR;
            case "completeness", "check-pdf" -> COMPLETENESS;
            default -> throw new IllegalArgumentException("Unsupported command: " + value);
        };
    }
}
