package com.mypodcasts.mime;

import com.mypodcasts.mime.headers.MimeHeaders;
import com.mypodcasts.mime.parts.MimePart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Parsed email message.
 *
 * <p>An immutable tree of {@link MimePart} rooted at the top level entity.
 * <br>The root part carries the message headers.
 *
 * @see EmailParser
 */
public class EmailMessage {

    /**
     * Root part.
     */
    private final MimePart root;

    /**
     * Constructs a new EmailMessage instance.
     *
     * @param root Root part.
     */
    public EmailMessage(MimePart root) {
        this.root = root;
    }

    /**
     * Gets root part.
     *
     * @return MimePart instance.
     */
    public MimePart getRoot() {
        return root;
    }

    /**
     * Gets message headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeaders() {
        return root.getHeaders();
    }

    /**
     * Gets first header value by case-insensitive name.
     *
     * @param name         Header name.
     * @param defaultValue Value returned when the header is absent.
     * @return Header value.
     */
    public String getHeader(String name, String defaultValue) {
        return root.getHeaders().getValue(name, defaultValue);
    }

    /**
     * Is multipart.
     *
     * @return Boolean.
     */
    public boolean isMultipart() {
        return root.getContentType().startsWith("multipart/");
    }

    /**
     * Walks the part tree depth-first in document order.
     * <p>The root itself comes first, containers precede their children.
     *
     * @return Unmodifiable list of MimePart.
     */
    public List<MimePart> walk() {
        List<MimePart> list = new ArrayList<>();
        Deque<MimePart> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            MimePart part = stack.pop();
            list.add(part);

            List<MimePart> children = part.getParts();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return Collections.unmodifiableList(list);
    }
}
