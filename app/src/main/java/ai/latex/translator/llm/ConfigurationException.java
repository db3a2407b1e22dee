package ai.latex.translator.llm;

/**
 * The fixer cannot run with the current settings, for example because no API key is set.
 */
public class ConfigurationException extends LlmFixException {

    public ConfigurationException(String message) {
        super(message);
    }
}
