package ai.latex.translator.llm;

import ai.latex.translator.config.LlmConfig;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the LangChain4j chat model for the configured provider.
 */
public final class ChatModelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFactory.class);
    private static final double TEMPERATURE = 0.1;

    private ChatModelFactory() {
    }

    public static ChatModel create(LlmConfig config, Optional<String> apiKey) {
        return switch (config.provider()) {
            case OPENAI -> createOpenAiChatModel(config, requireKey(config, apiKey));
            case OLLAMA -> createOllamaChatModel(config);
            case GEMINI -> createGeminiChatModel(config, requireKey(config, apiKey));
        };
    }

    private static String requireKey(LlmConfig config, Optional<String> apiKey) {
        return apiKey.filter(value -> !value.isBlank())
                .orElseThrow(() -> new ConfigurationException(
                        "LLM_API_KEY must be provided when LLM_PROVIDER=" + config.provider().name().toLowerCase()));
    }

    private static ChatModel createOpenAiChatModel(LlmConfig config, String apiKey) {
        String baseUrl = config.baseUrl().orElse("https://api.openai.com/v1");
        LOGGER.info("Using OpenAI-compatible model '{}' via {}", config.modelName(), baseUrl);
        try {
            return OpenAiChatModel.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .modelName(config.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(config.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(LlmConfig config) {
        String baseUrl = config.baseUrl()
                .orElseThrow(() -> new ConfigurationException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
        LOGGER.info("Using Ollama model '{}' via {}", config.modelName(), baseUrl);
        try {
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(config.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(config.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(LlmConfig config, String apiKey) {
        LOGGER.info("Using Gemini model '{}'", config.modelName());
        try {
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(config.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
