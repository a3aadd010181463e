package com.mypodcasts.speech;

import java.util.regex.Pattern;

/**
 * Collapses flattened HTML text into canonical spacing.
 *
 * <p>A fixed, order-sensitive sequence of rewrites:
 * <ol>
 *     <li>Line endings become LF.</li>
 *     <li>Quoted-printable soft breaks (<i>=</i>, optional whitespace, line break) are deleted.</li>
 *     <li>Runs of three or more line breaks separated only by whitespace become one blank line.</li>
 *     <li>Runs of horizontal whitespace become one space.</li>
 *     <li>Spaces before a line break are dropped.</li>
 *     <li>The whole text is trimmed.</li>
 * </ol>
 * <p>Applying it to its own output changes nothing.
 */
public class WhitespaceNormalizer {

    private static final Pattern LINE_ENDINGS = Pattern.compile("\r\n?");
    private static final Pattern SOFT_BREAK = Pattern.compile("=\\s*\n", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern BLANK_LINES = Pattern.compile("\n\\s*\n\\s*\n+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[^\\S\n]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TRAILING_SPACE = Pattern.compile(" +\n");
    private static final Pattern OUTER_SPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Normalizes text.
     *
     * @param text Flattened text.
     * @return Normalized text.
     */
    public String normalize(String text) {
        String result = LINE_ENDINGS.matcher(text).replaceAll("\n");
        result = SOFT_BREAK.matcher(result).replaceAll("");
        result = BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = HORIZONTAL_SPACE.matcher(result).replaceAll(" ");
        result = TRAILING_SPACE.matcher(result).replaceAll("\n");
        return trim(result);
    }

    /**
     * Trims Unicode whitespace from both ends.
     *
     * @param text Text string.
     * @return Trimmed string.
     */
    static String trim(String text) {
        return OUTER_SPACE.matcher(text).replaceAll("");
    }
}
