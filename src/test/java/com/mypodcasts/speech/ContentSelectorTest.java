package com.mypodcasts.speech;

import com.mypodcasts.exceptions.ContentDecodeException;
import com.mypodcasts.exceptions.MalformedMessageException;
import com.mypodcasts.exceptions.NoRenderableContentException;
import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.mime.EmailParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class ContentSelectorTest {

    private final ContentSelector selector = new ContentSelector();

    private static EmailMessage load(String name) throws IOException, MalformedMessageException {
        return new EmailParser(Paths.get("src/test/resources/emails/" + name)).parse();
    }

    @Test
    @DisplayName("HTML part wins over an earlier plain text part")
    void htmlOverPlain() throws Exception {
        String html = selector.select(load("newsletter.eml"));

        assertTrue(html.startsWith("<html><body>"), html);
        assertFalse(html.contains("Plain text version"));
    }

    @Test
    @DisplayName("First HTML part in depth first order is selected and decoded with its charset")
    void firstInOrder() throws Exception {
        assertEquals("<p>Inner café content.</p>", selector.select(load("nested.eml")));
    }

    @Test
    @DisplayName("Message without HTML fails")
    void noHtml() {
        NoRenderableContentException e = assertThrows(NoRenderableContentException.class, () -> selector.select(load("plain-only.eml")));
        assertEquals("No HTML part found in the email", e.getMessage());
    }

    @Test
    @DisplayName("Bytes invalid in the declared charset fail")
    void invalidBytes() throws Exception {
        byte[] raw = ("Content-Type: text/html; charset=utf-8\n\n<p>café</p>\n").getBytes(StandardCharsets.ISO_8859_1);
        EmailMessage message = new EmailParser(raw).parse();

        ContentDecodeException e = assertThrows(ContentDecodeException.class, () -> selector.select(message));
        assertEquals("utf-8", e.getCharset());
    }

    @Test
    @DisplayName("Unknown charset fails strictly and falls back leniently")
    void unknownCharset() throws Exception {
        EmailMessage message = new EmailParser("Content-Type: text/html; charset=x-nonsense\n\n<p>hi</p>".getBytes(StandardCharsets.US_ASCII)).parse();

        assertThrows(ContentDecodeException.class, () -> selector.select(message));
        assertEquals("<p>hi</p>", ContentSelector.decodeLenient(message.getRoot()));
    }

    @Test
    @DisplayName("Find first plain text part")
    void findFirstText() throws Exception {
        assertEquals("Plain text version, never spoken.\n", selector.findFirstText(load("newsletter.eml"), "text/plain").orElse(null));
        assertTrue(selector.findFirstText(load("apocalypse.eml"), "text/plain").isEmpty());
    }
}
