package com.yongkangl.parsimony.util;

/**
 * Thrown when an input tree or its leaf states cannot be reconstructed, before any pass has run.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
