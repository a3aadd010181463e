package com.mypodcasts.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class MailDateParserTest {

    private final MailDateParser parser = new MailDateParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Tue, 15 Oct 2024 08:30:00 -0400|2024-10-15T08:30",
            "Tue, 15 Oct 2024 23:59:59 +1400|2024-10-15T23:59:59",
            "15 Oct 2024 08:30 GMT|2024-10-15T08:30",
            "Wednesday, 1 Jan 2025 00:00:00 +0000 (UTC)|2025-01-01T00:00",
            "Tue 15 Oct 2024 08:30:00 -0400|2024-10-15T08:30",
            "3 Feb 99 07:15 GMT|1999-02-03T07:15",
            "3 Feb 24 07:15 GMT|2024-02-03T07:15",
            "Mon, 01-Jan-2024 10:00:00|2024-01-01T10:00",
            "Oct 15, 2024 08:30:00 EST|2024-10-15T08:30",
            "  Fri,  29 Feb 2008  12:00:00.123  +0100  |2008-02-29T12:00",
            "Tue, 15 Oct 2024 10:00:00 +0000 GMT|2024-10-15T10:00",
            "Tue, 15 Oct 2024 10:00:00 GMT+0000|2024-10-15T10:00",
            "Tue, 15 Oct 2024 10.00.00 +0000|2024-10-15T10:00",
            "15 Oct 2024 9.05 +0000|2024-10-15T09:05",
            "15 October 2024 10:00:00 +0000 (CEST) extra|2024-10-15T10:00"
    })
    @DisplayName("Parse mail dates as written")
    void valid(String value, String expected) {
        assertEquals(LocalDateTime.parse(expected), parser.parse(value).orElse(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not a date",
            "2024-10-15",
            "Tue, 15 Oct 2024",
            "31 Feb 2024 10:00:00 +0000",
            "15 Foo 2024 10:00:00 +0000",
            "15 Oct 2024 25:00:00 +0000",
            "15 Oct 12024 10:00:00 +0000"
    })
    @DisplayName("Reject invalid dates")
    void invalid(String value) {
        assertTrue(parser.parse(value).isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "15 Oct 0000 10:00:00 +0000|2000-10-15T10:00",
            "15 Oct 0099 10:00:00 +0000|1999-10-15T10:00",
            "15 Oct 068 10:00:00 +0000|2068-10-15T10:00",
            "15 Oct 202 10:00:00 +0000|0202-10-15T10:00",
            "15 Oct 1999 10:00:00 +0000|1999-10-15T10:00"
    })
    @DisplayName("Years below 100 expand whatever their digit count")
    void shortYears(String value, String expected) {
        assertEquals(LocalDateTime.parse(expected), parser.parse(value).orElse(null));
    }

    @Test
    void nullValue() {
        assertTrue(parser.parse(null).isEmpty());
    }
}
