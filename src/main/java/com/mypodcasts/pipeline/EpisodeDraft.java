package com.mypodcasts.pipeline;

import com.mypodcasts.exceptions.EmailProcessingException;
import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.processor.EmailProcessor;
import com.mypodcasts.processor.ProcessedEmail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to synthesize and publish one episode.
 *
 * <p>Built from a processed email, its preset and the preset feed's adapter:
 * <pre>
 * NewsletterPreset preset = Presets.resolve("levine");
 * EpisodeDraft draft = EpisodeDraft.prepare(processor, preset, SourceAdapters.forFeed(preset.feedSlug(), resolver));
 * </pre>
 */
public class EpisodeDraft {
    private static final Logger log = LogManager.getLogger(EpisodeDraft.class);

    private final String title;
    private final String slug;
    private final String objectKey;
    private final String body;
    private final String sourceUrl;
    private final NewsletterPreset preset;
    private final String ttsModel;
    private final String ttsVoice;

    /**
     * Constructs a new EpisodeDraft instance.
     *
     * @param title     Episode title.
     * @param slug      Episode slug.
     * @param body      Text to synthesize.
     * @param sourceUrl Issue address or null.
     * @param preset    NewsletterPreset instance.
     * @param ttsModel  Effective model.
     * @param ttsVoice  Effective voice.
     */
    public EpisodeDraft(String title, String slug, String body, String sourceUrl, NewsletterPreset preset, String ttsModel, String ttsVoice) {
        this.title = title;
        this.slug = slug;
        this.objectKey = "episodes/" + preset.feedSlug() + "/" + slug + ".mp3";
        this.body = body;
        this.sourceUrl = sourceUrl;
        this.preset = preset;
        this.ttsModel = ttsModel;
        this.ttsVoice = ttsVoice;
    }

    /**
     * Prepares a draft using the process environment for model and voice overrides.
     *
     * @param processor EmailProcessor instance.
     * @param preset    NewsletterPreset instance.
     * @param adapter   SourceAdapter instance.
     * @return EpisodeDraft instance.
     * @throws EmailProcessingException Message cannot be processed.
     */
    public static EpisodeDraft prepare(EmailProcessor processor, NewsletterPreset preset, SourceAdapter adapter) throws EmailProcessingException {
        return prepare(processor, preset, adapter, System.getenv());
    }

    /**
     * Prepares a draft.
     *
     * @param processor   EmailProcessor instance.
     * @param preset      NewsletterPreset instance.
     * @param adapter     SourceAdapter instance.
     * @param environment Environment variables.
     * @return EpisodeDraft instance.
     * @throws EmailProcessingException Message cannot be processed.
     */
    public static EpisodeDraft prepare(EmailProcessor processor, NewsletterPreset preset, SourceAdapter adapter, Map<String, String> environment) throws EmailProcessingException {
        ProcessedEmail email = processor.parse();
        EmailMessage message = processor.getMessage();

        String title = adapter.formatTitle(email.getDate(), email.getSubjectRaw(), email.getSubject());
        String body = adapter.cleanBody(message, email.getBody());
        String sourceUrl = adapter.extractSourceUrl(message, email.getDate(), email.getSubjectRaw()).orElse(null);

        EpisodeDraft draft = new EpisodeDraft(title, email.getStem(), body, sourceUrl, preset,
                Presets.effectiveModel(preset, environment),
                Presets.effectiveVoice(preset, environment));
        log.debug("Prepared episode {} for feed {}", draft.getObjectKey(), preset.feedSlug());

        return draft;
    }

    /**
     * Gets title.
     *
     * @return Title string.
     */
    public String getTitle() {
        return title;
    }

    /**
     * Gets slug.
     *
     * @return <i>date-subject</i> string.
     */
    public String getSlug() {
        return slug;
    }

    /**
     * Gets storage key of the audio file.
     *
     * @return <i>episodes/feed/slug.mp3</i> string.
     */
    public String getObjectKey() {
        return objectKey;
    }

    /**
     * Gets text to synthesize.
     *
     * @return Body string.
     */
    public String getBody() {
        return body;
    }

    /**
     * Gets issue address.
     *
     * @return Optional of URL.
     */
    public Optional<String> getSourceUrl() {
        return Optional.ofNullable(sourceUrl);
    }

    /**
     * Gets preset.
     *
     * @return NewsletterPreset instance.
     */
    public NewsletterPreset getPreset() {
        return preset;
    }

    /**
     * Gets feed identifier.
     *
     * @return Feed slug.
     */
    public String getFeedSlug() {
        return preset.feedSlug();
    }

    /**
     * Gets speech model.
     *
     * @return Model name.
     */
    public String getTtsModel() {
        return ttsModel;
    }

    /**
     * Gets speech voice.
     *
     * @return Voice name.
     */
    public String getTtsVoice() {
        return ttsVoice;
    }
}
