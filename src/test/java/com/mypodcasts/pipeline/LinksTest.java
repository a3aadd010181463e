package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinksTest {

    @Test
    @DisplayName("Collect links from text parts in order without duplicates")
    void candidateLinks() throws Exception {
        List<String> links = Links.candidateLinks(new EmailParser(Paths.get("src/test/resources/emails/levine.eml")).parse());

        assertEquals(List.of("https://bloom.bg/3xYz9Ab", "https://twitter.com/moneystuff"), links);
    }

    @ParameterizedTest
    @CsvSource({
            "https://example.com/p/post?utm=1#top, https://example.com/p/post",
            "https://example.com/a#frag, https://example.com/a",
            "http://example.com, http://example.com"
    })
    @DisplayName("Canonical form drops query and fragment")
    void canonicalize(String url, String expected) {
        assertEquals(expected, Links.canonicalize(url));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Banks Are Weird|banks-are-weird",
            "'  The SEC: new -- rule! '|the-sec-new-rule",
            "Café|caf",
            "'!!!'|''"
    })
    @DisplayName("Publisher style slugs")
    void slugifyForUrl(String text, String expected) {
        assertEquals(expected, Links.slugifyForUrl(text));
    }
}
