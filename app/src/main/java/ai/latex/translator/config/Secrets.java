package ai.latex.translator.config;

import java.util.Optional;

/**
 * Holds credentials for the chat model endpoint.
 */
public record Secrets(Optional<String> llmApiKey) {

    public Secrets {
        llmApiKey = llmApiKey == null ? Optional.empty() : llmApiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[llmApiKey=" + (llmApiKey.isPresent() ? "***" : "<unset>") + "]";
    }
}
