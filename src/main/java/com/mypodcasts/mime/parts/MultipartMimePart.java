package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multipart MIME part.
 *
 * <p>Container for <i>multipart/*</i> types holding its body parts in declared order.
 */
public class MultipartMimePart extends MimePart {

    /**
     * Body parts.
     */
    private final List<MimePart> parts;

    /**
     * Constructs a new MultipartMimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     * @param parts       Body parts.
     */
    public MultipartMimePart(MimeHeaders headers, String contentType, List<MimePart> parts) {
        super(headers, contentType);
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    /**
     * Gets boundary parameter.
     *
     * @return Boundary string or null.
     */
    public String getBoundary() {
        return headers.get("Content-Type")
                .map(h -> h.getParameter("boundary"))
                .orElse(null);
    }

    @Override
    public List<MimePart> getParts() {
        return parts;
    }

    @Override
    public boolean isContainer() {
        return true;
    }
}
