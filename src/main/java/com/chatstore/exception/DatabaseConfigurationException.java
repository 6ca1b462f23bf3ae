package com.chatstore.exception;

/**
 * Exception thrown when the database connection cannot be configured,
 * typically because no connection URL was supplied.
 */
public class DatabaseConfigurationException extends RuntimeException {

    public DatabaseConfigurationException(String message) {
        super(message);
    }

    public DatabaseConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
