package ai.latex.translator.config;

import java.util.Locale;

/**
 * Chat model backends the repair fixer can talk to.
 */
public enum LlmProvider {
    OPENAI(true),
    OLLAMA(false),
    GEMINI(true);

    private final boolean requiresApiKey;

    LlmProvider(boolean requiresApiKey) {
        this.requiresApiKey = requiresApiKey;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "ollama" -> OLLAMA;
            case "gemini" -> GEMINI;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
