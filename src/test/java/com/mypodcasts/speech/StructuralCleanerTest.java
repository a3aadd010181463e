package com.mypodcasts.speech;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralCleanerTest {

    private final StructuralCleaner cleaner = new StructuralCleaner();

    @Test
    @DisplayName("Hidden elements are removed with their subtree")
    void hidden() {
        String text = cleaner.cleanToText("<div>Shown</div><div style=\"color: red; DISPLAY :none\"><p>Hidden <b>deep</b></p></div><span style=\"display:none\">Also hidden</span>");

        assertEquals("Shown", text);
    }

    @Test
    @DisplayName("Everything after the last footnote is truncated at every level")
    void truncation() {
        String html = "<div class=\"post\">" +
                "<p>Intro text.</p>" +
                "<div id=\"footnote-1\">[1] One.</div>" +
                "<div id=\"footnote-2\">[2] Two.</div>" +
                "<div>Share this</div>" +
                "</div>" +
                "<section><h3>Related Articles</h3></section>" +
                "trailing text";

        String text = cleaner.cleanToText(html);

        assertTrue(text.contains("Intro text."), text);
        assertTrue(text.contains("[2] Two."), text);
        assertFalse(text.contains("Share this"), text);
        assertFalse(text.contains("Related Articles"), text);
        assertFalse(text.contains("trailing text"), text);
    }

    @Test
    @DisplayName("Identifiers only resembling footnotes do not truncate")
    void footnoteLookalikes() {
        String text = cleaner.cleanToText("<div id=\"footnote-x\">a</div><div id=\"my-footnote-1\">b</div><p>c</p>");

        assertEquals("ab\n\nc", text);
    }

    @Test
    @DisplayName("Blockquotes are announced")
    void blockquote() {
        String text = cleaner.cleanToText("before<blockquote>quoted</blockquote>after");

        assertEquals("before" + StructuralCleaner.BLOCK_QUOTE_BEGINS + "quoted" + StructuralCleaner.BLOCK_QUOTE_ENDS + "after", text);
    }

    @Test
    @DisplayName("Paragraphs and headings start with a blank line")
    void paragraphs() {
        String text = cleaner.cleanToText("<h2>Title</h2><p>One</p><p>Two <i>words</i></p><div>Inline</div>");

        assertEquals("\n\nTitle\n\nOne\n\nTwo wordsInline", text);
    }

    @Test
    @DisplayName("Scripts, styles and comments are not text")
    void nonText() {
        String text = cleaner.cleanToText("<html><head><style>p{}</style></head><body><!-- c --><script>x()</script>body</body></html>");

        assertEquals("body", text);
    }

    @Test
    @DisplayName("Empty and null input give empty text")
    void empty() {
        assertEquals("", cleaner.cleanToText(""));
        assertEquals("", cleaner.cleanToText(null));
    }
}
