package com.mypodcasts.metadata;

import java.util.regex.Pattern;

/**
 * Slug utilities.
 */
public class Slugs {

    /**
     * Anything but word characters, whitespace and hyphens.
     */
    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Leading and trailing whitespace.
     */
    private static final Pattern OUTER_SPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Whitespace runs.
     */
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Private constructor.
     */
    private Slugs() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Slugifies free text.
     * <p>Case is kept. Slugifying a slug returns it unchanged.
     *
     * @param text Text string.
     * @return Slug string.
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }

        String safe = UNSAFE.matcher(text).replaceAll("");
        safe = OUTER_SPACE.matcher(safe).replaceAll("");
        return WHITESPACE.matcher(safe).replaceAll("-");
    }
}
