package com.perfsentinel.core.persistence;

/**
 * Thrown by a {@link PersistenceSink} that could not store a batch.
 *
 * @since 1.0.0
 */
public class PersistenceException extends Exception {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
