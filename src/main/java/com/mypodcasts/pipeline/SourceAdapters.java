package com.mypodcasts.pipeline;

/**
 * Source adapter lookup by feed.
 */
public class SourceAdapters {

    /**
     * Private constructor.
     */
    private SourceAdapters() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets adapter for feed.
     *
     * @param feedSlug Feed identifier.
     * @param resolver RedirectResolver used by adapters that follow links.
     * @return SourceAdapter instance, {@link DefaultAdapter} for unknown feeds.
     */
    public static SourceAdapter forFeed(String feedSlug, RedirectResolver resolver) {
        if (feedSlug == null) {
            return new DefaultAdapter();
        }

        return switch (feedSlug) {
            case "levine" -> new LevineAdapter(resolver);
            case "yglesias" -> new SubstackAdapter("Slow Boring", "slowboring.com", resolver);
            case "silver" -> new SubstackAdapter("Silver Bulletin", "natesilver.net", resolver);
            default -> new DefaultAdapter();
        };
    }
}
