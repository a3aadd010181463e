package com.mypodcasts.mime.headers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MIME headers container.
 *
 * <p>Keeps headers in the order they were read.
 * <p>Lookups are case-insensitive and return the first occurrence.
 */
public class MimeHeaders {

    /**
     * Headers list.
     */
    private final List<MimeHeader> headers = new ArrayList<>();

    /**
     * Adds header.
     *
     * @param header MimeHeader instance.
     * @return Self.
     */
    public MimeHeaders put(MimeHeader header) {
        headers.add(header);
        return this;
    }

    /**
     * Gets first header by name.
     *
     * @param name Header name.
     * @return Optional of MimeHeader.
     */
    public Optional<MimeHeader> get(String name) {
        return headers.stream()
                .filter(h -> h.isNamed(name))
                .findFirst();
    }

    /**
     * Gets first header value by name or the given default.
     *
     * @param name         Header name.
     * @param defaultValue Value returned when the header is absent.
     * @return Header value.
     */
    public String getValue(String name, String defaultValue) {
        return get(name).map(MimeHeader::getValue).orElse(defaultValue);
    }

    /**
     * Gets header count.
     *
     * @return Size.
     */
    public int size() {
        return headers.size();
    }
}
