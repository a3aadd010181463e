package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailMessage;

import java.util.Optional;

/**
 * Per newsletter presentation rules.
 */
public interface SourceAdapter {

    /**
     * Formats episode title.
     *
     * @param date        Date string.
     * @param subjectRaw  Decoded subject.
     * @param subjectSlug Subject slug.
     * @return Title string.
     */
    String formatTitle(String date, String subjectRaw, String subjectSlug);

    /**
     * Cleans the speech body.
     *
     * @param message Parsed message.
     * @param body    Speech ready body of the HTML part.
     * @return Body string.
     */
    String cleanBody(EmailMessage message, String body);

    /**
     * Finds the web address of the newsletter issue.
     *
     * @param message    Parsed message.
     * @param date       Date string.
     * @param subjectRaw Decoded subject.
     * @return Optional of canonical URL.
     */
    Optional<String> extractSourceUrl(EmailMessage message, String date, String subjectRaw);
}
