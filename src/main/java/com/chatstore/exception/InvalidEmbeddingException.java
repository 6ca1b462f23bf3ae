package com.chatstore.exception;

/**
 * Exception thrown when a vector does not have the dimension the store expects.
 */
public class InvalidEmbeddingException extends RuntimeException {

    public InvalidEmbeddingException(String message) {
        super(message);
    }

    public InvalidEmbeddingException(int expected, int actual) {
        super(String.format("Embedding must have %d dimensions but has %d", expected, actual));
    }
}
