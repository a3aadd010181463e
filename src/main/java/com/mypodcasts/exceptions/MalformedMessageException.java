package com.mypodcasts.exceptions;

/**
 * Thrown when the input cannot be parsed as a structured message at all.
 */
public class MalformedMessageException extends EmailProcessingException {

    /**
     * Constructs a new MalformedMessageException.
     *
     * @param message Error message.
     */
    public MalformedMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedMessageException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
