package io.fullerstack.domaintrie;

/**
 * Exception thrown when an empty string is registered as a domain suffix.
 */
public class EmptySuffixException extends RuntimeException {

    public EmptySuffixException(String message) {
        super(message);
    }

    public EmptySuffixException(String message, Throwable cause) {
        super(message, cause);
    }
}
