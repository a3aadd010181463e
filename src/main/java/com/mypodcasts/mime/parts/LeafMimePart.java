package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

/**
 * Base for parts holding a transfer-decoded payload.
 */
abstract class LeafMimePart extends MimePart {

    /**
     * Payload after Content-Transfer-Encoding decoding.
     */
    private final byte[] bytes;

    /**
     * Constructs a new LeafMimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     * @param bytes       Decoded payload.
     */
    LeafMimePart(MimeHeaders headers, String contentType, byte[] bytes) {
        super(headers, contentType);
        this.bytes = bytes != null ? bytes.clone() : new byte[0];
    }

    @Override
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public int getSize() {
        return bytes.length;
    }
}
