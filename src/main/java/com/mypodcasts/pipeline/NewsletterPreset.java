package com.mypodcasts.pipeline;

import java.util.List;
import java.util.Locale;

/**
 * Newsletter preset.
 * <p>Binds route tags to the voice, category and feed an episode is published with.
 *
 * @param name      Display name.
 * @param routeTags Lowercase tags routing a message to this preset.
 * @param ttsModel  Speech synthesis model.
 * @param ttsVoice  Speech synthesis voice.
 * @param category  Podcast category.
 * @param feedSlug  Feed identifier.
 */
public record NewsletterPreset(String name, List<String> routeTags, String ttsModel, String ttsVoice, String category, String feedSlug) {

    /**
     * Constructs a new NewsletterPreset instance.
     */
    public NewsletterPreset {
        routeTags = List.copyOf(routeTags);
    }

    /**
     * Checks if tag routes to this preset.
     *
     * @param tag Route tag, case and surrounding whitespace ignored.
     * @return Boolean.
     */
    public boolean matches(String tag) {
        return tag != null && routeTags.contains(tag.trim().toLowerCase(Locale.ROOT));
    }
}
