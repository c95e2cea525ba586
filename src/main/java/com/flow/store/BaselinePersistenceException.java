package com.flow.store;

/**
 * Durable baseline storage could not be read or written.
 */
public class BaselinePersistenceException extends RuntimeException {

    public BaselinePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
