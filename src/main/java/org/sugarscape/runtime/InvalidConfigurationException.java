package org.sugarscape.runtime;

/**
 * Thrown at startup when simulation parameters cannot describe a runnable model,
 * e.g. non-positive grid dimensions or a non-positive metabolism range.
 * <p>
 * Extends {@link IllegalArgumentException} so callers that already guard against
 * invalid arguments handle it without further changes.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
