package io.github.jbellis.mobilize.config;

/**
 * Thrown when a mobilization option fails validation. Raised while options are
 * built or loaded, never while a document is being rewritten.
 */
public class InvalidOptionException extends IllegalArgumentException {

    private final String optionName;

    public InvalidOptionException(String optionName, String message) {
        super(optionName + ": " + message);
        this.optionName = optionName;
    }

    public InvalidOptionException(String optionName, String message, Throwable cause) {
        super(optionName + ": " + message, cause);
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }
}
