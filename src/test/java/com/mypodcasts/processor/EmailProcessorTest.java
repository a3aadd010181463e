package com.mypodcasts.processor;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mypodcasts.exceptions.DanglingFootnoteException;
import com.mypodcasts.exceptions.MalformedMessageException;
import com.mypodcasts.exceptions.NoRenderableContentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class EmailProcessorTest {

    private static EmailProcessor load(String name) throws IOException, MalformedMessageException {
        return new EmailProcessor(Files.readAllBytes(Paths.get("src/test/resources/emails/" + name)));
    }

    @Test
    @DisplayName("Minimal newsletter without date")
    void apocalypse() throws Exception {
        ProcessedEmail email = new EmailProcessor("Subject: My apocalypse: the end is near!\n" +
                "Content-Type: text/html\n" +
                "\n" +
                "<p>Some content here.</p>\n").parse();

        assertEquals("9999-12-31", email.getDate());
        assertEquals("My-apocalypse-the-end-is-near", email.getSubject());
        assertEquals("My apocalypse: the end is near!", email.getSubjectRaw());
        assertEquals("Some content here.", email.getBody());
    }

    @Test
    @DisplayName("Full newsletter pipeline")
    void newsletter() throws Exception {
        ProcessedEmail email = load("newsletter.eml").parse();

        assertEquals("2024-10-15", email.getDate());
        assertEquals("Café-notes-week-42", email.getSubject());
        assertEquals("Week 42\n\n" +
                "First paragraph Footnote begins. The first footnote. Footnote ends. with text.\n\n" +
                "Block quote begins.\n\n" +
                "Quoted words.\n\n" +
                "Block quote ends.\n\n" +
                "Second paragraph.", email.getBody());
    }

    @Test
    @DisplayName("Repeated processing gives equal records")
    void stateless() throws Exception {
        EmailProcessor processor = load("levine.eml");

        ProcessedEmail first = processor.parse();
        ProcessedEmail second = processor.parse();
        assertEquals(first.toJson(), second.toJson());
        assertEquals("Banks are weird Footnote begins. Sometimes. Footnote ends. today.\n\nView in browser", first.getBody());
    }

    @Test
    @DisplayName("Message without HTML part fails")
    void noHtml() throws Exception {
        EmailProcessor processor = load("plain-only.eml");

        assertThrows(NoRenderableContentException.class, processor::parse);
    }

    @Test
    @DisplayName("Dangling footnote fails the whole message")
    void dangling() throws Exception {
        EmailProcessor processor = new EmailProcessor("Subject: x\nContent-Type: text/html\n\n<p>See [7].</p>");

        DanglingFootnoteException e = assertThrows(DanglingFootnoteException.class, processor::parse);
        assertEquals("7", e.getFootnoteId());
    }

    @Test
    @DisplayName("Input that is not a message fails on construction")
    void malformed() {
        assertThrows(MalformedMessageException.class, () -> new EmailProcessor("just some words"));
    }

    @Test
    @DisplayName("JSON uses the record keys")
    void json() throws Exception {
        JsonObject json = JsonParser.parseString(load("apocalypse.eml").parse().toJson()).getAsJsonObject();

        assertEquals(4, json.size());
        assertEquals("9999-12-31", json.get("date").getAsString());
        assertEquals("My-apocalypse-the-end-is-near", json.get("subject").getAsString());
        assertEquals("My apocalypse: the end is near!", json.get("subject_raw").getAsString());
        assertEquals("Some content here.", json.get("body").getAsString());
    }

    @Test
    @DisplayName("Body is written to date-slug.txt")
    void writeTextFile(@TempDir Path tempDir) throws Exception {
        Path outputDir = tempDir.resolve("emails");

        Path path = load("newsletter.eml").writeTextFile(outputDir);

        assertEquals(outputDir.resolve("2024-10-15-Café-notes-week-42.txt"), path);
        assertTrue(Files.readString(path, StandardCharsets.UTF_8).startsWith("Week 42\n\nFirst paragraph"));
    }
}
