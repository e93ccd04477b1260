package com.alertrelay.core.driver;

/**
 * Thrown by {@link SourceDriver#parse} when the payload does not have the
 * driver's shape, i.e. whenever {@link SourceDriver#validate} would return
 * {@code false}.
 *
 * @since 1.0.0
 */
public class InvalidPayloadException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
