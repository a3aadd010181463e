package com.mypodcasts.mime.parts;

import com.mypodcasts.mime.headers.MimeHeaders;

import java.util.Collections;
import java.util.List;

/**
 * Embedded message MIME part.
 *
 * <p>Container for <i>message/rfc822</i> parts.
 * <br>Its only child is the root part of the embedded message, so walks descend into forwarded mail.
 */
public class MessageMimePart extends MimePart {

    /**
     * Embedded message root part.
     */
    private final MimePart root;

    /**
     * Constructs a new MessageMimePart instance.
     *
     * @param headers     Part headers.
     * @param contentType Resolved content type.
     * @param root        Embedded message root part.
     */
    public MessageMimePart(MimeHeaders headers, String contentType, MimePart root) {
        super(headers, contentType);
        this.root = root;
    }

    /**
     * Gets embedded message headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getMessageHeaders() {
        return root.getHeaders();
    }

    @Override
    public List<MimePart> getParts() {
        return Collections.singletonList(root);
    }

    @Override
    public boolean isContainer() {
        return true;
    }
}
