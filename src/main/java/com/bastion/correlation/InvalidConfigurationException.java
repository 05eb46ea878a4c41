package com.bastion.correlation;

/**
 * Thrown at construction time when detection settings or the signature catalogue
 * are unusable. Indicates a broken deployment, so it is not caught by the engine.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
