package com.mypodcasts.exceptions;

/**
 * Thrown when no HTML part exists anywhere in the message.
 *
 * <p>The message is structurally deficient; retrying with the same input will not help.
 */
public class NoRenderableContentException extends EmailProcessingException {

    /**
     * Constructs a new NoRenderableContentException.
     *
     * @param message Error message.
     */
    public NoRenderableContentException(String message) {
        super(message);
    }
}
