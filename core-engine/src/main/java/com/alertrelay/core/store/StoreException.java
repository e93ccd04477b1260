package com.alertrelay.core.store;

/**
 * Raised by {@link AlertStore} implementations when a read or write fails.
 *
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
