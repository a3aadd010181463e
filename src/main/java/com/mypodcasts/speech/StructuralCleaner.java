package com.mypodcasts.speech;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Prunes newsletter HTML into a document that reads well once flattened to text.
 *
 * <p>Steps run in this order, each assuming the previous ones are done:
 * <ol>
 *     <li>Remove elements styled <i>display: none</i> (preheaders, tracking blocks).</li>
 *     <li>Truncate everything after the last <i>footnote-N</i> element at every ancestor level.</li>
 *     <li>Announce blockquotes with spoken begin and end markers.</li>
 *     <li>Put a blank line before every paragraph and heading.</li>
 * </ol>
 * <p>{@link #flatten(Document)} then concatenates the remaining text nodes.
 * <p>Elements to delete are collected into a snapshot list before any is removed.
 */
public class StructuralCleaner {
    private static final Logger log = LogManager.getLogger(StructuralCleaner.class);

    /**
     * Zero visibility style declaration.
     */
    private static final Pattern HIDDEN_STYLE = Pattern.compile("display\\s*:\\s*none", Pattern.CASE_INSENSITIVE);

    /**
     * Footnote container identifier.
     */
    private static final Pattern FOOTNOTE_ID = Pattern.compile("^footnote-[0-9]+$");

    /**
     * Marker placed before a blockquote.
     */
    public static final String BLOCK_QUOTE_BEGINS = "\n\nBlock quote begins.\n";

    /**
     * Marker placed after a blockquote.
     */
    public static final String BLOCK_QUOTE_ENDS = "\n\nBlock quote ends.\n";

    /**
     * Marker placed before paragraphs and headings.
     */
    public static final String PARAGRAPH_BREAK = "\n\n";

    /**
     * Parses and cleans HTML then flattens it to text.
     *
     * @param html HTML string.
     * @return Flattened text, empty for empty or markup free input.
     */
    public String cleanToText(String html) {
        return flatten(clean(html));
    }

    /**
     * Parses and cleans HTML.
     *
     * @param html HTML string.
     * @return Cleaned Document ready for flattening.
     */
    public Document clean(String html) {
        Document document = Jsoup.parse(html != null ? html : "");

        removeHidden(document);
        truncateAfterFootnotes(document);
        annotateBlockquotes(document);
        markParagraphs(document);

        return document;
    }

    /**
     * Concatenates all text in document order, discarding markup.
     * <p>Script and style data and comments are not text and are skipped.
     *
     * @param document Document instance.
     * @return Text string.
     */
    public String flatten(Document document) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                text.append(((TextNode) node).getWholeText());
            }
        }, document);

        return text.toString();
    }

    /**
     * Removes every element whose style hides it, with its subtree.
     *
     * @param document Document instance.
     */
    void removeHidden(Document document) {
        List<Element> hidden = new ArrayList<>();
        for (Element element : document.getAllElements()) {
            if (element != document && HIDDEN_STYLE.matcher(element.attr("style")).find()) {
                hidden.add(element);
            }
        }

        hidden.forEach(Element::remove);
        log.debug("Removed {} hidden elements", hidden.size());
    }

    /**
     * Keeps everything up to the end of the last footnote container.
     * <p>Walking up from that element to the document, all following siblings at each level are removed.
     *
     * @param document Document instance.
     */
    void truncateAfterFootnotes(Document document) {
        Element last = null;
        for (Element element : document.getAllElements()) {
            if (FOOTNOTE_ID.matcher(element.id()).matches()) {
                last = element;
            }
        }

        if (last == null) {
            return;
        }

        int removed = 0;
        Node current = last;
        while (current.parentNode() != null) {
            Node parent = current.parentNode();
            List<Node> following = new ArrayList<>(parent.childNodes().subList(current.siblingIndex() + 1, parent.childNodeSize()));
            following.forEach(Node::remove);
            removed += following.size();
            current = parent;
        }

        log.debug("Truncated {} nodes following {}", removed, last.id());
    }

    /**
     * Surrounds blockquotes with spoken markers.
     *
     * @param document Document instance.
     */
    void annotateBlockquotes(Document document) {
        Elements quotes = document.getElementsByTag("blockquote");
        for (Element quote : quotes) {
            quote.before(new TextNode(BLOCK_QUOTE_BEGINS));
            quote.after(new TextNode(BLOCK_QUOTE_ENDS));
        }
    }

    /**
     * Puts a blank line before paragraphs and headings.
     *
     * @param document Document instance.
     */
    void markParagraphs(Document document) {
        for (Element element : document.select("p, h1, h2, h3, h4, h5, h6")) {
            if (element.parentNode() != null) {
                element.before(new TextNode(PARAGRAPH_BREAK));
            }
        }
    }
}
