package com.cohort.core.persistence;

/**
 * Thrown when the backing store cannot complete a read or write.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
