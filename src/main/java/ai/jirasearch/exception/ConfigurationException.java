package ai.jirasearch.exception;

/** Raised when required settings are missing from the environment. Always raised before any network activity. */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }
}
