package com.mypodcasts.mime.headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * MIME header container.
 *
 * <p>Holds an unfolded header name and value.
 * <p>Values of structured headers such as Content-Type can be split into their clean value and parameters.
 *
 * <pre>
 * MimeHeader header = new MimeHeader("Content-Type: text/html; charset=\"utf-8\"");
 * header.getCleanValue();          // text/html
 * header.getParameter("charset");  // utf-8
 * </pre>
 */
public class MimeHeader {

    /**
     * Header name as written.
     */
    private final String name;

    /**
     * Unfolded header value.
     */
    private final String value;

    /**
     * Lazily parsed parameters.
     */
    private Map<String, String> parameters;

    /**
     * Constructs a new MimeHeader instance from a raw header line.
     * <p>Folding line breaks are removed.
     *
     * @param header Raw header string.
     */
    public MimeHeader(String header) {
        String unfolded = unfold(header);
        int colon = unfolded.indexOf(':');
        if (colon > 0) {
            this.name = unfolded.substring(0, colon).trim();
            this.value = unfolded.substring(colon + 1).trim();
        } else {
            this.name = unfolded.trim();
            this.value = "";
        }
    }

    /**
     * Constructs a new MimeHeader instance with given name and value.
     *
     * @param name  Header name.
     * @param value Header value.
     */
    public MimeHeader(String name, String value) {
        this.name = name;
        this.value = value != null ? unfold(value).trim() : "";
    }

    /**
     * Gets header name.
     *
     * @return Name string.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets header value.
     *
     * @return Value string.
     */
    public String getValue() {
        return value;
    }

    /**
     * Gets header value without parameters, lowercased.
     * <p>For <i>text/html; charset=utf-8</i> this returns <i>text/html</i>.
     *
     * @return Clean value string.
     */
    public String getCleanValue() {
        int semicolon = value.indexOf(';');
        String clean = semicolon >= 0 ? value.substring(0, semicolon) : value;
        return clean.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets header parameter by case-insensitive name.
     *
     * @param key Parameter name.
     * @return Parameter value or null if absent.
     */
    public String getParameter(String key) {
        return getParameters().get(key.toLowerCase(Locale.ROOT));
    }

    /**
     * Gets all header parameters keyed by lowercase name.
     *
     * @return Unmodifiable map of parameters.
     */
    public Map<String, String> getParameters() {
        if (parameters == null) {
            parameters = Collections.unmodifiableMap(parseParameters(value));
        }
        return parameters;
    }

    /**
     * Checks header name ignoring case.
     *
     * @param other Header name to compare with.
     * @return Boolean.
     */
    public boolean isNamed(String other) {
        return name.equalsIgnoreCase(other);
    }

    /**
     * Parses <i>; key=value</i> pairs following the clean value.
     * <p>Quoted values may contain semicolons and backslash escapes.
     *
     * @param value Header value.
     * @return Map of parameters.
     */
    private static Map<String, String> parseParameters(String value) {
        Map<String, String> map = new LinkedHashMap<>();

        int pos = value.indexOf(';');
        while (pos >= 0 && pos < value.length()) {
            pos++;
            int eq = value.indexOf('=', pos);
            if (eq < 0) {
                break;
            }

            String key = value.substring(pos, eq);
            key = key.substring(key.lastIndexOf(';') + 1).trim().toLowerCase(Locale.ROOT);
            pos = eq + 1;
            while (pos < value.length() && Character.isWhitespace(value.charAt(pos))) {
                pos++;
            }

            StringBuilder val = new StringBuilder();
            if (pos < value.length() && value.charAt(pos) == '"') {
                pos++;
                while (pos < value.length() && value.charAt(pos) != '"') {
                    char c = value.charAt(pos);
                    if (c == '\\' && pos + 1 < value.length()) {
                        c = value.charAt(++pos);
                    }
                    val.append(c);
                    pos++;
                }
                pos = value.indexOf(';', pos);
            } else {
                int end = value.indexOf(';', pos);
                val.append(end >= 0 ? value.substring(pos, end) : value.substring(pos));
                pos = end;
            }

            if (!key.isEmpty() && !map.containsKey(key)) {
                map.put(key, val.toString().trim());
            }
        }

        return map;
    }

    /**
     * Removes folding line breaks.
     *
     * @param header Header string.
     * @return Unfolded string.
     */
    private static String unfold(String header) {
        return header.replaceAll("\r?\n(?=[ \t])", "").replaceAll("[\r\n]+$", "");
    }

    @Override
    public String toString() {
        return name + ": " + value;
    }
}
