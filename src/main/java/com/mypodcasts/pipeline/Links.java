package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.mime.parts.MimePart;
import com.mypodcasts.speech.ContentSelector;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Link utilities.
 */
public class Links {

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>'\"]+");
    private static final Pattern URL_UNSAFE = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HYPHENS = Pattern.compile("-+");

    /**
     * Private constructor.
     */
    private Links() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets every http(s) link of the text parts in order of first appearance.
     * <p>Trailing punctuation picked up from the surrounding prose is dropped.
     *
     * @param message EmailMessage instance.
     * @return List of URLs without duplicates.
     */
    public static List<String> candidateLinks(EmailMessage message) {
        List<String> chunks = new ArrayList<>();
        for (MimePart part : message.walk()) {
            String type = part.getContentType();
            if (!part.isContainer() && (type.equals("text/plain") || type.equals("text/html"))) {
                chunks.add(ContentSelector.decodeLenient(part));
            }
        }

        Set<String> links = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(String.join("\n", chunks));
        while (matcher.find()) {
            links.add(StringUtils.stripEnd(matcher.group(), ").,>"));
        }

        return new ArrayList<>(links);
    }

    /**
     * Drops query and fragment.
     *
     * @param url URL string.
     * @return Scheme, host and path.
     */
    public static String canonicalize(String url) {
        int end = StringUtils.indexOfAny(url, '?', '#');
        return end >= 0 ? url.substring(0, end) : url;
    }

    /**
     * Slugifies text the way publishers build article paths.
     * <p>Lowercase ASCII letters, digits and single hyphens only.
     *
     * @param text Text string.
     * @return Slug string, empty if nothing usable remains.
     */
    public static String slugifyForUrl(String text) {
        String slug = text.toLowerCase(Locale.ROOT).strip();
        slug = URL_UNSAFE.matcher(slug).replaceAll("");
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        slug = HYPHENS.matcher(slug).replaceAll("-");
        return StringUtils.strip(slug, "-");
    }
}
