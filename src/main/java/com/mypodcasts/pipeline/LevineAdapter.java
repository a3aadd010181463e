package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for Matt Levine's Money Stuff.
 *
 * <p>The issue address is found in this order:
 * <ol>
 *     <li>A direct newsletter link in the body.</li>
 *     <li>A Bloomberg short link redirecting to a newsletter.</li>
 *     <li>An address built from the date and the subject topic.</li>
 * </ol>
 */
public class LevineAdapter extends DefaultAdapter {
    private static final Logger log = LogManager.getLogger(LevineAdapter.class);

    private static final Pattern NEWSLETTER = Pattern.compile(
            "^https://www\\.bloomberg\\.com/opinion/newsletters/\\d{4}-\\d{2}-\\d{2}/[^/?#]+",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TOPIC = Pattern.compile("^Money Stuff:\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private static final List<String> SHORT_LINK_PREFIXES = List.of(
            "https://bloom.bg/",
            "https://links.message.bloomberg.com/");

    private static final String NEWSLETTER_BASE = "https://www.bloomberg.com/opinion/newsletters/";

    private final RedirectResolver resolver;

    /**
     * Constructs a new LevineAdapter instance.
     *
     * @param resolver RedirectResolver instance.
     */
    public LevineAdapter(RedirectResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String formatTitle(String date, String subjectRaw, String subjectSlug) {
        String subject = subject(subjectRaw, subjectSlug);
        Matcher topic = TOPIC.matcher(subject);
        if (topic.matches()) {
            return date + " - Money Stuff - " + topic.group(1).strip();
        }
        return date + " - " + subject;
    }

    @Override
    public Optional<String> extractSourceUrl(EmailMessage message, String date, String subjectRaw) {
        List<String> links = Links.candidateLinks(message);

        for (String link : links) {
            if (NEWSLETTER.matcher(link).lookingAt()) {
                return Optional.of(Links.canonicalize(link));
            }
        }

        for (String link : links) {
            if (SHORT_LINK_PREFIXES.stream().anyMatch(link::startsWith)) {
                Optional<String> target = resolver.resolveOnce(link);
                if (target.isPresent() && NEWSLETTER.matcher(target.get()).lookingAt()) {
                    return Optional.of(Links.canonicalize(target.get()));
                }
            }
        }

        Matcher topic = TOPIC.matcher(subjectRaw != null ? subjectRaw.strip() : "");
        if (topic.matches()) {
            String slug = Links.slugifyForUrl(topic.group(1));
            if (!slug.isEmpty()) {
                log.debug("Inferred newsletter address from subject topic {}", slug);
                return Optional.of(NEWSLETTER_BASE + date + "/" + slug);
            }
        }

        return Optional.empty();
    }
}
