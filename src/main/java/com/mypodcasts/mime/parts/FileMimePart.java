package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

/**
 * File MIME part.
 *
 * <p>Non-text leaf such as images and attachments.
 */
public class FileMimePart extends LeafMimePart {

    /**
     * Constructs a new FileMimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     * @param bytes       Decoded payload.
     */
    public FileMimePart(MimeHeaders headers, String contentType, byte[] bytes) {
        super(headers, contentType, bytes);
    }
}
