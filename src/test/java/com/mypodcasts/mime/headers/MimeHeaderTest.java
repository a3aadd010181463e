package com.mypodcasts.mime.headers;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MimeHeaderTest {

    @Test
    @DisplayName("Split raw header into name and value")
    void rawHeader() {
        MimeHeader header = new MimeHeader("Subject:  Hello world \r\n");

        assertEquals("Subject", header.getName());
        assertEquals("Hello world", header.getValue());
        assertTrue(header.isNamed("subject"));
    }

    @Test
    @DisplayName("Unfold continuation lines")
    void unfold() {
        MimeHeader header = new MimeHeader("Subject: Money Stuff:\r\n the long\n\tweekend\r\n");

        assertEquals("Money Stuff: the long\tweekend", header.getValue());
    }

    @Test
    @DisplayName("Clean value and parameters of a content type")
    void parameters() {
        MimeHeader header = new MimeHeader("Content-Type", "Text/HTML; Charset=\"UTF-8\"; format=flowed");

        assertEquals("text/html", header.getCleanValue());
        assertEquals("UTF-8", header.getParameter("charset"));
        assertEquals("flowed", header.getParameter("FORMAT"));
        assertNull(header.getParameter("boundary"));
    }

    @Test
    @DisplayName("Quoted parameters keep semicolons and escapes")
    void quotedParameter() {
        MimeHeader header = new MimeHeader("Content-Type: multipart/mixed; boundary=\"a;b\\\"c\"; name=x");

        assertEquals("a;b\"c", header.getParameter("boundary"));
        assertEquals("x", header.getParameter("name"));
        assertEquals(2, header.getParameters().size());
    }

    @Test
    @DisplayName("Headers lookup is case-insensitive and returns the first match")
    void headersLookup() {
        MimeHeaders headers = new MimeHeaders()
                .put(new MimeHeader("Received: one"))
                .put(new MimeHeader("Received: two"));

        assertEquals(2, headers.size());
        assertEquals("one", headers.getValue("RECEIVED", "none"));
        assertEquals("none", headers.getValue("Date", "none"));
        assertTrue(headers.get("date").isEmpty());
    }
}
