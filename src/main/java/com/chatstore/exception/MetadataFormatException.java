package com.chatstore.exception;

/**
 * Exception thrown when metadata cannot be converted to or from JSON.
 */
public class MetadataFormatException extends RuntimeException {

    public MetadataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
