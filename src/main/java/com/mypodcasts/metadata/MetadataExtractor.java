package com.mypodcasts.metadata;

import com.mypodcasts.mime.EmailMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.UnsupportedEncodingException;
import java.time.format.DateTimeFormatter;

/**
 * Derives filing metadata from message headers.
 *
 * <p>Never fails: a missing or unparsable date yields {@link #UNKNOWN_DATE} and a missing subject yields
 * {@link #DEFAULT_SUBJECT}. Encoded words that cannot be decoded are kept as written.
 */
public class MetadataExtractor {
    private static final Logger log = LogManager.getLogger(MetadataExtractor.class);

    /**
     * Date used when the header is absent or unparsable.
     * <p>Sorts after every real date.
     */
    public static final String UNKNOWN_DATE = "9999-12-31";

    /**
     * Subject used when the header is absent.
     */
    public static final String DEFAULT_SUBJECT = "No Subject";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final MailDateParser dateParser = new MailDateParser();

    /**
     * Extracts metadata.
     *
     * @param message EmailMessage instance.
     * @return EmailMetadata instance.
     */
    public EmailMetadata extract(EmailMessage message) {
        String subject = decodeSubject(message.getHeader("Subject", DEFAULT_SUBJECT));
        return new EmailMetadata(extractDate(message), Slugs.slugify(subject), subject);
    }

    /**
     * Gets the calendar date of the Date header.
     *
     * @param message EmailMessage instance.
     * @return Date string.
     */
    public String extractDate(EmailMessage message) {
        String value = message.getHeader("Date", null);
        String date = dateParser.parse(value)
                .map(DATE_FORMAT::format)
                .orElse(UNKNOWN_DATE);

        if (value != null && date.equals(UNKNOWN_DATE)) {
            log.debug("Unparsable date header: {}", value);
        }

        return date;
    }

    /**
     * Decodes RFC 2047 encoded words.
     *
     * @param value Raw header value.
     * @return Decoded and trimmed value.
     */
    String decodeSubject(String value) {
        try {
            return MimeUtility.decodeText(value).trim();
        } catch (UnsupportedEncodingException e) {
            log.warn("Subject left undecoded: {}", e.getMessage());
            return value.trim();
        }
    }
}
