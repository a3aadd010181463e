package com.mypodcasts.exceptions;

/**
 * Base of all failures raised while turning an email into speech text.
 *
 * <p>Subclasses are distinct so callers can tell an unusable message apart from a bug.
 *
 * @see MalformedMessageException
 * @see NoRenderableContentException
 * @see ContentDecodeException
 * @see DanglingFootnoteException
 */
public class EmailProcessingException extends Exception {

    /**
     * Constructs a new EmailProcessingException.
     *
     * @param message Error message.
     */
    public EmailProcessingException(String message) {
        super(message);
    }

    /**
     * Constructs a new EmailProcessingException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public EmailProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
