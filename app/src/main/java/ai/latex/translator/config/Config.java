package ai.latex.translator.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration assembled from CLI arguments and environment variables.
 */
public record Config(Command command,
                     Optional<Path> file,
                     Optional<Path> original,
                     Optional<Path> originalPdf,
                     Optional<Path> translatedPdf,
                     boolean llmFix,
                     boolean restoreOnFailure,
                     LogFormat logFormat,
                     LlmConfig llmConfig,
                     Secrets secrets) {

    public Config {
        command = Objects.requireNonNull(command, "command");
        file = file == null ? Optional.empty() : file;
        original = original == null ? Optional.empty() : original;
        originalPdf = originalPdf == null ? Optional.empty() : originalPdf;
        translatedPdf = translatedPdf == null ? Optional.empty() : translatedPdf;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        llmConfig = Objects.requireNonNull(llmConfig, "llmConfig");
        secrets = secrets == null ? Secrets.none() : secrets;

        switch (command) {
            case VALIDATE, REPAIR -> {
                if (file.isEmpty()) {
                    throw new IllegalArgumentException("--file is required for the " + command.name().toLowerCase() + " command");
                }
            }
            case COMPLETENESS -> {
                if (originalPdf.isEmpty() || translatedPdf.isEmpty()) {
                    throw new IllegalArgumentException("--original-pdf and --translated-pdf are required for the completeness command");
                }
            }
        }
        if (original.isPresent() && command != Command.REPAIR) {
            throw new IllegalArgumentException("--original is only supported by the repair command");
        }
    }
}
