package ai.latex.translator.llm;

import ai.latex.translator.config.LlmConfig;
import ai.latex.translator.validate.SyntaxError;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort repair: sends the findings and the document to a chat model and returns its answer
 * verbatim. Never writes to disk, so an aborted call leaves no partial state behind.
 */
public class LlmSyntaxFixer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LlmSyntaxFixer.class);
    private static final Pattern STATUS_PATTERN = Pattern.compile("(?:status(?: code)?|HTTP)[ :=]*([1-5][0-9]{2})", Pattern.CASE_INSENSITIVE);

    private final LlmConfig config;
    private final Optional<ChatModel> model;

    public LlmSyntaxFixer(LlmConfig config, Optional<String> apiKey) {
        this(config, apiKey, key -> ChatModelFactory.create(config, Optional.ofNullable(key)));
    }

    /**
     * @param modelFactory builds the chat model from the API key; only invoked when a usable key is present
     *                     or the provider needs none
     */
    public LlmSyntaxFixer(LlmConfig config, Optional<String> apiKey, Function<String, ChatModel> modelFactory) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(modelFactory, "modelFactory");
        Optional<String> key = apiKey == null ? Optional.empty() : apiKey.filter(value -> !value.isBlank());
        if (key.isEmpty() && config.provider().requiresApiKey()) {
            this.model = Optional.empty();
        } else {
            this.model = Optional.of(modelFactory.apply(key.orElse(null)));
        }
    }

    public boolean isConfigured() {
        return model.isPresent();
    }

    /**
     * @throws ConfigurationException when no API key is configured
     * @throws ApiCallException when the endpoint fails after all retry attempts
     */
    public String fix(String content, List<SyntaxError> errors) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(errors, "errors");
        ChatModel chatModel = model.orElseThrow(() -> new ConfigurationException(
                "LLM API key is not configured; set LLM_API_KEY to enable LLM fixes"));
        if (content.isEmpty() || errors.isEmpty()) {
            return content;
        }
        String prompt = FixPromptBuilder.build(content, errors);
        LOGGER.info("Requesting LLM fix for {} issue(s) from {} model '{}'", errors.size(),
                config.provider().name().toLowerCase(), config.modelName());
        return chatWithRetry(chatModel, prompt);
    }

    private String chatWithRetry(ChatModel chatModel, String prompt) {
        int maxAttempts = config.maxRetryAttempts();
        for (int attempt = 0; ; attempt++) {
            try {
                String response = chatModel.chat(prompt);
                if (response == null || response.isBlank()) {
                    throw new ApiCallException("LLM returned an empty response", OptionalInt.empty(), false, null);
                }
                return response;
            } catch (ApiCallException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                ApiCallException failure = toApiCallException(ex);
                if (!failure.retryable() || attempt >= maxAttempts - 1) {
                    LOGGER.error("LLM fix failed after {} attempt(s): {}", attempt + 1, ex.getMessage());
                    throw failure;
                }
                Duration delay = calculateRetryDelay(attempt);
                LOGGER.warn("LLM call failed ({}); retrying in {} ms (attempt {}/{})",
                        ex.getMessage(), delay.toMillis(), attempt + 1, maxAttempts);
                sleep(delay, failure);
            }
        }
    }

    Duration calculateRetryDelay(int attemptNumber) {
        long baseDelaySeconds = config.initialBackoffSeconds() * (1L << Math.min(attemptNumber, 20));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, config.maxBackoffSeconds());
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * config.retryJitterFactor();
        return Duration.ofMillis(Math.max(0L, (long) (cappedDelaySeconds * 1000 * jitterMultiplier)));
    }

    private void sleep(Duration delay, ApiCallException failure) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            LOGGER.warn("LLM retry interrupted");
            throw failure;
        }
    }

    static ApiCallException toApiCallException(RuntimeException ex) {
        OptionalInt status = statusOf(ex);
        boolean retryable = status.isPresent()
                ? status.getAsInt() == 429 || status.getAsInt() >= 500
                : isTransient(ex);
        String message = "LLM API call failed" + (status.isPresent() ? " with status " + status.getAsInt() : "")
                + ": " + ex.getMessage();
        return new ApiCallException(message, status, retryable, ex);
    }

    private static OptionalInt statusOf(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return OptionalInt.of(429);
            }
            if (cause instanceof ModelNotFoundException) {
                return OptionalInt.of(404);
            }
            String message = cause.getMessage();
            if (message != null) {
                if (message.contains("RESOURCE_EXHAUSTED")) {
                    return OptionalInt.of(429);
                }
                Matcher matcher = STATUS_PATTERN.matcher(message);
                if (matcher.find()) {
                    return OptionalInt.of(Integer.parseInt(matcher.group(1)));
                }
            }
            cause = cause.getCause();
        }
        return OptionalInt.empty();
    }

    private static boolean isTransient(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof IOException || cause instanceof TimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
