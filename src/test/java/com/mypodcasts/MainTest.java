package com.mypodcasts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return new Main(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)).run();
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("JSON output of an eml file")
    void json() {
        assertEquals(0, run("", "--input-file", "src/test/resources/emails/apocalypse.eml", "--json"));

        assertTrue(out().contains("\"subject_raw\": \"My apocalypse: the end is near!\""), out());
        assertTrue(out().contains("\"body\": \"Some content here.\""), out());
        assertFalse(out().contains("Processing complete."));
    }

    @Test
    @DisplayName("Write text file to the given directory")
    void writeTextFile(@TempDir Path tempDir) throws Exception {
        assertEquals(0, run("", "-i", "src/test/resources/emails/newsletter.eml", "-w", "-o", tempDir.toString()));

        Path path = tempDir.resolve("2024-10-15-Café-notes-week-42.txt");
        assertTrue(Files.exists(path));
        assertTrue(out().contains("Body text saved to " + path), out());
    }

    @Test
    @DisplayName("Positional message and reminder when no output is requested")
    void positional() {
        assertEquals(0, run("", "Subject: Hi\nContent-Type: text/html\n\n<p>Hello</p>"));

        assertEquals("Processing complete. Use --json or --write-text-file to output the results.", out().strip());
    }

    @Test
    @DisplayName("Standard input is read when nothing else is given")
    void stdin() {
        assertEquals(0, run("Subject: From stdin\nContent-Type: text/html\n\n<p>Piped</p>", "-j"));

        assertTrue(out().contains("\"subject\": \"From-stdin\""), out());
    }

    @Test
    @DisplayName("Episode preview for a feed")
    void feed() {
        assertEquals(0, run("", "-i", "src/test/resources/emails/substack.eml", "--feed", "yglesias", "-j"));

        assertTrue(out().contains("Title: 2024-10-17 - Slow Boring - The case for more housing"), out());
        assertTrue(out().contains("Key: episodes/yglesias/2024-10-17-Slow-Boring-The-case-for-more-housing.mp3"), out());
        assertTrue(out().contains("Source: https://www.slowboring.com/p/the-case-for-more-housing"), out());
    }

    @Test
    @DisplayName("Missing HTML exits with 1")
    void noHtml() {
        assertEquals(1, run("", "-i", "src/test/resources/emails/plain-only.eml", "-j"));

        assertEquals("Error: No HTML part found in the email", err().strip());
    }

    @Test
    @DisplayName("Missing HTML exits with 1 without output options")
    void noHtmlWithoutOutput() {
        assertEquals(1, run("", "-i", "src/test/resources/emails/plain-only.eml"));

        assertEquals("Error: No HTML part found in the email", err().strip());
        assertFalse(out().contains("Processing complete."), out());
    }

    @Test
    @DisplayName("Dangling footnote exits with 2 without output options")
    void danglingFootnoteWithoutOutput() {
        assertEquals(2, run("", "Subject: Hi\nContent-Type: text/html\n\n<p>See [7].</p>"));

        assertEquals("Error: Footnote 7 not found.", err().strip());
        assertFalse(out().contains("Processing complete."), out());
    }

    @Test
    @DisplayName("Other failures exit with 2")
    void failures() {
        assertEquals(2, run("", "-i", "src/test/resources/emails/missing.eml"));
        assertEquals(2, run("", "not an email"));
        assertTrue(err().startsWith("Error: "), err());
    }

    @Test
    @DisplayName("Usage")
    void help() {
        assertEquals(0, run("", "--help"));

        assertTrue(out().contains("--write-text-file"), out());
        assertTrue(out().contains(Main.USAGE), out());
    }
}
