package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailMessage;

import java.util.Optional;

/**
 * Adapter for newsletters without specific rules.
 * <p>Title is the subject, body is kept and there is no source address.
 */
public class DefaultAdapter implements SourceAdapter {

    @Override
    public String formatTitle(String date, String subjectRaw, String subjectSlug) {
        return subject(subjectRaw, subjectSlug);
    }

    @Override
    public String cleanBody(EmailMessage message, String body) {
        return body;
    }

    @Override
    public Optional<String> extractSourceUrl(EmailMessage message, String date, String subjectRaw) {
        return Optional.empty();
    }

    /**
     * Gets trimmed subject or the slug spelled out with spaces if the subject is blank.
     *
     * @param subjectRaw  Decoded subject.
     * @param subjectSlug Subject slug.
     * @return Subject string.
     */
    protected String subject(String subjectRaw, String subjectSlug) {
        String subject = subjectRaw != null ? subjectRaw.strip() : "";
        return !subject.isEmpty() ? subject : subjectSlug.replace('-', ' ');
    }
}
