package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

/**
 * Text MIME part.
 *
 * <p>Any <i>text/*</i> leaf such as plain text or HTML.
 * <br>The payload is still bytes; charset decoding is left to the consumer.
 */
public class TextMimePart extends LeafMimePart {

    /**
     * Constructs a new TextMimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     * @param bytes       Decoded payload.
     */
    public TextMimePart(MimeHeaders headers, String contentType, byte[] bytes) {
        super(headers, contentType, bytes);
    }
}
