package io.formulakit.standalone.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML or an invalid value. The
 * message is suitable for command-line error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
