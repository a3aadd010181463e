package com.mypodcasts.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Built-in newsletter presets.
 */
public class Presets {

    /**
     * Environment variable overriding the preset model.
     */
    public static final String TTS_MODEL_ENV = "TTS_MODEL";

    /**
     * Environment variable overriding the preset voice.
     */
    public static final String TTS_VOICE_ENV = "TTS_VOICE";

    public static final NewsletterPreset LEVINE = new NewsletterPreset(
            "Matt Levine - Money Stuff",
            List.of("levine", "money-stuff", "moneystuff", "bloomberg"),
            "tts-1-hd", "ash", "Business", "levine");

    public static final NewsletterPreset YGLESIAS = new NewsletterPreset(
            "Yglesias Substack",
            List.of("yglesias", "slowboring", "substack-yglesias"),
            "tts-1-hd", "sage", "News", "yglesias");

    public static final NewsletterPreset SILVER = new NewsletterPreset(
            "Nate Silver - Silver Bulletin",
            List.of("silver", "natesilver", "silverbulletin"),
            "tts-1-hd", "echo", "News", "silver");

    /**
     * Preset for anything without a matching tag.
     */
    public static final NewsletterPreset GENERAL = new NewsletterPreset(
            "General Newsletter",
            List.of(),
            "tts-1-hd", "ash", "News", "general");

    private static final List<NewsletterPreset> PRESETS = List.of(LEVINE, YGLESIAS, SILVER);

    /**
     * Private constructor.
     */
    private Presets() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets all tagged presets.
     *
     * @return List of NewsletterPreset.
     */
    public static List<NewsletterPreset> all() {
        return PRESETS;
    }

    /**
     * Resolves preset by route tag.
     *
     * @param routeTag Route tag, may be null or blank.
     * @return Matching preset or {@link #GENERAL}.
     */
    public static NewsletterPreset resolve(String routeTag) {
        if (routeTag == null || routeTag.isBlank()) {
            return GENERAL;
        }

        for (NewsletterPreset preset : PRESETS) {
            if (preset.matches(routeTag)) {
                return preset;
            }
        }

        return GENERAL;
    }

    /**
     * Gets model to synthesize with from the process environment.
     *
     * @param preset NewsletterPreset instance.
     * @return Model name.
     */
    public static String effectiveModel(NewsletterPreset preset) {
        return effectiveModel(preset, System.getenv());
    }

    /**
     * Gets model to synthesize with.
     *
     * @param preset      NewsletterPreset instance.
     * @param environment Environment variables.
     * @return Model name.
     */
    public static String effectiveModel(NewsletterPreset preset, Map<String, String> environment) {
        return environment.getOrDefault(TTS_MODEL_ENV, preset.ttsModel());
    }

    /**
     * Gets voice to synthesize with from the process environment.
     *
     * @param preset NewsletterPreset instance.
     * @return Voice name.
     */
    public static String effectiveVoice(NewsletterPreset preset) {
        return effectiveVoice(preset, System.getenv());
    }

    /**
     * Gets voice to synthesize with.
     *
     * @param preset      NewsletterPreset instance.
     * @param environment Environment variables.
     * @return Voice name.
     */
    public static String effectiveVoice(NewsletterPreset preset, Map<String, String> environment) {
        return environment.getOrDefault(TTS_VOICE_ENV, preset.ttsVoice());
    }
}
