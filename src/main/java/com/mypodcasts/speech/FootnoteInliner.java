package com.mypodcasts.speech;

import com.mypodcasts.exceptions.DanglingFootnoteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads footnotes inline where they are referenced.
 *
 * <p>Definitions are lines such as <i>[1] This is footnote one.</i> at the tail of the text.
 * <br>Each pointer <i>[1]</i> in the body becomes <i>Footnote begins. This is footnote one. Footnote ends.</i>
 * <p>Collection and substitution are separate passes so substitution never sees the definition lines.
 */
public class FootnoteInliner {
    private static final Logger log = LogManager.getLogger(FootnoteInliner.class);

    /**
     * Definition line including its line break.
     */
    private static final Pattern DEFINITION = Pattern.compile("^\\[([0-9]+)][^\\S\\n]*(.+)$\\n?", Pattern.MULTILINE);

    /**
     * Pointer anywhere in the text.
     */
    private static final Pattern POINTER = Pattern.compile("\\[([0-9]+)]");

    /**
     * Inlines footnotes.
     *
     * @param text Normalized text.
     * @return Text with pointers replaced and definitions removed, trimmed.
     * @throws DanglingFootnoteException If a pointer has no definition.
     */
    public String inline(String text) throws DanglingFootnoteException {
        Map<String, String> footnotes = new HashMap<>();
        String remaining = collect(text, footnotes);
        String result = substitute(remaining, footnotes);

        if (!footnotes.isEmpty()) {
            log.debug("Inlined {} footnote definitions", footnotes.size());
        }

        return WhitespaceNormalizer.trim(result);
    }

    /**
     * Collects definitions and removes their lines.
     * <p>A later definition for the same number replaces an earlier one.
     *
     * @param text      Text string.
     * @param footnotes Table to fill, keyed by footnote number.
     * @return Text without definition lines.
     */
    String collect(String text, Map<String, String> footnotes) {
        Matcher matcher = DEFINITION.matcher(text);
        StringBuilder remaining = new StringBuilder(text.length());
        int last = 0;

        while (matcher.find()) {
            footnotes.put(matcher.group(1), matcher.group(2));
            remaining.append(text, last, matcher.start());
            last = matcher.end();
        }
        remaining.append(text, last, text.length());

        return remaining.toString();
    }

    /**
     * Replaces every pointer with its spoken definition.
     *
     * @param text      Text without definition lines.
     * @param footnotes Footnote table.
     * @return Text with pointers replaced.
     * @throws DanglingFootnoteException On the first pointer without a definition.
     */
    String substitute(String text, Map<String, String> footnotes) throws DanglingFootnoteException {
        Matcher matcher = POINTER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        int last = 0;

        while (matcher.find()) {
            String id = matcher.group(1);
            String definition = footnotes.get(id);
            if (definition == null) {
                throw new DanglingFootnoteException(id);
            }

            result.append(text, last, matcher.start())
                    .append("Footnote begins. ")
                    .append(WhitespaceNormalizer.trim(definition))
                    .append(" Footnote ends.");
            last = matcher.end();
        }
        result.append(text, last, text.length());

        return result.toString();
    }
}
