package ai.latex.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime settings for the chat model used by the LLM fixer, including its retry policy.
 */
public record LlmConfig(LlmProvider provider,
                        String modelName,
                        Optional<String> baseUrl,
                        Duration timeout,
                        int maxRetryAttempts,
                        int initialBackoffSeconds,
                        int maxBackoffSeconds,
                        double retryJitterFactor) {

    public LlmConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 0) {
            throw new IllegalArgumentException("initialBackoffSeconds must not be negative");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException("retryJitterFactor must be between 0.0 and 1.0");
        }
    }

    public static LlmConfig defaults(LlmProvider provider, String modelName, Optional<String> baseUrl) {
        return new LlmConfig(provider, modelName, baseUrl, Duration.ofSeconds(120), 2, 2, 60, 0.3);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
