package com.mypodcasts.exceptions;

/**
 * Thrown when a selected part's payload cannot be decoded as text in its charset.
 */
public class ContentDecodeException extends EmailProcessingException {

    /**
     * Charset the decode was attempted with.
     */
    private final String charset;

    /**
     * Constructs a new ContentDecodeException.
     *
     * @param charset Charset name.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ContentDecodeException(String charset, String message, Throwable cause) {
        super(message, cause);
        this.charset = charset;
    }

    /**
     * Gets the charset name.
     *
     * @return Charset name as declared or defaulted.
     */
    public String getCharset() {
        return charset;
    }
}
