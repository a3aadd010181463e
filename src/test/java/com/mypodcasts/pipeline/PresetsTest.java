package com.mypodcasts.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PresetsTest {

    @ParameterizedTest
    @CsvSource({
            "levine, levine",
            "'  Money-Stuff ', levine",
            "BLOOMBERG, levine",
            "slowboring, yglesias",
            "substack-yglesias, yglesias",
            "natesilver, silver",
            "unknown, general",
            "'', general"
    })
    @DisplayName("Resolve presets by route tag")
    void resolve(String tag, String feedSlug) {
        assertEquals(feedSlug, Presets.resolve(tag).feedSlug());
    }

    @Test
    void nullTag() {
        assertSame(Presets.GENERAL, Presets.resolve(null));
    }

    @Test
    @DisplayName("Built-in preset values")
    void values() {
        assertEquals("Matt Levine - Money Stuff", Presets.LEVINE.name());
        assertEquals("Business", Presets.LEVINE.category());
        assertEquals("sage", Presets.YGLESIAS.ttsVoice());
        assertEquals("echo", Presets.SILVER.ttsVoice());
        assertEquals("ash", Presets.GENERAL.ttsVoice());
        assertTrue(Presets.GENERAL.routeTags().isEmpty());
        assertEquals(3, Presets.all().size());
    }

    @Test
    @DisplayName("Environment overrides model and voice")
    void environment() {
        Map<String, String> environment = Map.of("TTS_MODEL", "gpt-4o-mini-tts", "TTS_VOICE", "nova");

        assertEquals("gpt-4o-mini-tts", Presets.effectiveModel(Presets.SILVER, environment));
        assertEquals("nova", Presets.effectiveVoice(Presets.SILVER, environment));
        assertEquals("tts-1-hd", Presets.effectiveModel(Presets.SILVER, Map.of()));
        assertEquals("echo", Presets.effectiveVoice(Presets.SILVER, Map.of()));
    }
}
