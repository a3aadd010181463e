package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * MIME part container.
 *
 * <p>Every node of a parsed message is a MimePart.
 * <br>Leaf parts carry a decoded payload, containers carry child parts.
 * <p>Parts are immutable once built by the parser.
 *
 * @see TextMimePart
 * @see FileMimePart
 * @see MultipartMimePart
 * @see MessageMimePart
 */
public abstract class MimePart {

    /**
     * Part headers.
     */
    protected final MimeHeaders headers;

    /**
     * Resolved lowercase content type without parameters.
     */
    protected final String contentType;

    /**
     * Constructs a new MimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     */
    protected MimePart(MimeHeaders headers, String contentType) {
        this.headers = headers;
        this.contentType = contentType;
    }

    /**
     * Gets part headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeaders() {
        return headers;
    }

    /**
     * Gets content type.
     * <p>Either the declared type or the default inherited from the parent container.
     *
     * @return Lowercase content type, e.g. <i>text/html</i>.
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Gets declared charset parameter.
     *
     * @return Optional of charset name.
     */
    public Optional<String> getCharset() {
        return headers.get("Content-Type")
                .map(h -> h.getParameter("charset"))
                .filter(s -> !s.isBlank());
    }

    /**
     * Gets decoded payload bytes.
     * <p>Containers have no payload of their own.
     *
     * @return Byte array.
     */
    public byte[] getBytes() {
        return new byte[0];
    }

    /**
     * Gets payload size.
     *
     * @return Size in bytes.
     */
    public int getSize() {
        return getBytes().length;
    }

    /**
     * Gets child parts in declared order.
     *
     * @return Unmodifiable list of MimePart.
     */
    public List<MimePart> getParts() {
        return Collections.emptyList();
    }

    /**
     * Is container.
     *
     * @return Boolean.
     */
    public boolean isContainer() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + contentType + ", " + getSize() + " bytes, " + getParts().size() + " parts]";
    }
}
