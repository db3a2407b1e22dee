package ai.latex.translator.config;

import ai.latex.translator.cli.CliArguments;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_LLM_API_URL = "LLM_API_URL";
    static final String ENV_LLM_API_KEY = "LLM_API_KEY";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_TIMEOUT_SECONDS = 120;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 2;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Command command = arguments.command() == null ? Command.VALIDATE : arguments.command();
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultModelFor(provider));

        Optional<String> baseUrl = switch (provider) {
            case OPENAI -> Optional.of(firstNonBlank(ENV_LLM_API_URL, DEFAULT_OPENAI_URL));
            case OLLAMA -> Optional.of(environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .orElseGet(() -> firstNonBlank(ENV_LLM_API_URL, DEFAULT_OLLAMA_URL)));
            case GEMINI -> Optional.empty();
        };

        Optional<String> apiKey = environmentReader.get(ENV_LLM_API_KEY)
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(fallbackKeyFor(provider)).filter(ConfigLoader::isNotBlank));

        int timeoutSeconds = readPositiveInteger(ENV_LLM_TIMEOUT_SECONDS, DEFAULT_LLM_TIMEOUT_SECONDS);
        int maxRetryAttempts = readPositiveInteger(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int initialBackoffSeconds = readPositiveInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int maxBackoffSeconds = readPositiveInteger(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double jitterFactor = environmentReader.get(ENV_LLM_RETRY_JITTER_FACTOR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseDouble)
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        LlmConfig llmConfig = new LlmConfig(provider, modelName, baseUrl, Duration.ofSeconds(timeoutSeconds),
                maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds, jitterFactor);

        return new Config(command,
                Optional.ofNullable(arguments.file()),
                Optional.ofNullable(arguments.original()),
                Optional.ofNullable(arguments.originalPdf()),
                Optional.ofNullable(arguments.translatedPdf()),
                arguments.llmFix(),
                arguments.restoreOnFailure(),
                logFormat,
                llmConfig,
                new Secrets(apiKey));
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> "gpt-4o-mini";
            case OLLAMA -> "qwen2.5:7b";
            case GEMINI -> "gemini-1.5-flash";
        };
    }

    private String fallbackKeyFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> ENV_GEMINI_API_KEY;
            case OPENAI, OLLAMA -> ENV_OPENAI_API_KEY;
        };
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int readPositiveInteger(String envKey, int defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(envKey, raw))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String envKey, String defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String envKey, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(envKey + " must be a positive integer");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
