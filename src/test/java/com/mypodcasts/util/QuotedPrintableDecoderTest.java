package com.mypodcasts.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class QuotedPrintableDecoderTest {

    private static String decode(String encoded) {
        return new String(QuotedPrintableDecoder.decode(encoded.getBytes(StandardCharsets.US_ASCII)), StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Caf=C3=A9|Café",
            "a=3Db|a=b",
            "lower=3d|lower=",
            "100% =ZZ sure|100% =ZZ sure",
            "dangling =|'dangling '"
    })
    @DisplayName("Decode escapes and keep invalid ones literally")
    void escapes(String encoded, String decoded) {
        assertEquals(decoded, decode(encoded));
    }

    @Test
    @DisplayName("Soft line breaks join lines and hard breaks are kept")
    void lineBreaks() {
        assertEquals("joined line\r\nnext\n", decode("joined =\r\nline\r\nnext\n"));
    }

    @Test
    @DisplayName("Trailing whitespace is transport padding")
    void trailingWhitespace() {
        assertEquals("text\nmore", decode("text \t\nmore"));
        assertEquals("keep inner", decode("keep inner=  \n"));
    }
}
