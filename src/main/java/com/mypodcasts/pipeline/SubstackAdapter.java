package com.mypodcasts.pipeline;

import com.mypodcasts.mime.EmailMessage;
import com.mypodcasts.speech.ContentSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for Substack hosted newsletters.
 *
 * <p>Substack plain text parts read better than their HTML so the body is rebuilt from the first
 * <i>text/plain</i> part with web links, app prompts and the unsubscribe footer removed.
 */
public class SubstackAdapter extends DefaultAdapter {

    private static final Pattern WEB_VIEW = Pattern.compile("^View this post on the web at .*\\n+");
    private static final Pattern BRACKETED_LINK = Pattern.compile("\\s*\\[\\s*https?://[^\\]]+\\s*]");
    private static final Pattern FOOTER = Pattern.compile("\\nUnsubscribe\\s+https?://.*", Pattern.DOTALL);
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern TRAILING_SPACE = Pattern.compile(" +\\n");

    private static final String REDIRECT_PREFIX = "https://substack.com/redirect/";

    /**
     * Name prefixed to titles.
     */
    private final String brandName;

    /**
     * Publication domain.
     */
    private final String domain;

    private final Pattern brandPrefix;
    private final Pattern postUrl;
    private final RedirectResolver resolver;

    /**
     * Constructs a new SubstackAdapter instance.
     *
     * @param brandName Publication name.
     * @param domain    Publication domain without scheme.
     * @param resolver  RedirectResolver instance.
     */
    public SubstackAdapter(String brandName, String domain, RedirectResolver resolver) {
        this.brandName = brandName;
        this.domain = domain;
        this.resolver = resolver;
        this.brandPrefix = Pattern.compile("^" + Pattern.quote(brandName) + ":\\s*", Pattern.CASE_INSENSITIVE);
        this.postUrl = Pattern.compile("https://(?:www\\.)?" + Pattern.quote(domain) + "/p/[^\\s<>?#]+", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Gets brand name.
     *
     * @return Brand name.
     */
    public String getBrandName() {
        return brandName;
    }

    /**
     * Gets domain.
     *
     * @return Domain string.
     */
    public String getDomain() {
        return domain;
    }

    @Override
    public String formatTitle(String date, String subjectRaw, String subjectSlug) {
        String subject = brandPrefix.matcher(subject(subjectRaw, subjectSlug)).replaceFirst("");
        return date + " - " + brandName + " - " + subject;
    }

    @Override
    public String cleanBody(EmailMessage message, String body) {
        String text = new ContentSelector().findFirstText(message, "text/plain").orElse(body);

        text = text.replace("\r", "")
                .replace("\u00ad", "")
                .replace("\u034f", "");

        text = WEB_VIEW.matcher(text).replaceFirst("");
        text = BRACKETED_LINK.matcher(text).replaceAll("");
        text = FOOTER.matcher(text).replaceAll("");
        text = text.replace("READ IN APP", "")
                .replace("Subscribed", "");

        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = TRAILING_SPACE.matcher(text).replaceAll("\n");

        return text.strip();
    }

    @Override
    public Optional<String> extractSourceUrl(EmailMessage message, String date, String subjectRaw) {
        String listPost = message.getHeader("List-Post", "");
        Matcher header = postUrl.matcher(listPost);
        if (header.find()) {
            return Optional.of(Links.canonicalize(header.group()));
        }

        List<String> links = Links.candidateLinks(message);
        List<String> redirects = new ArrayList<>();
        for (String link : links) {
            if (postUrl.matcher(link).lookingAt()) {
                return Optional.of(Links.canonicalize(link));
            }
            if (link.startsWith(REDIRECT_PREFIX) || link.contains(domain + "/action/")) {
                redirects.add(link);
            }
        }

        for (String link : redirects) {
            Optional<String> target = resolver.resolveOnce(link);
            if (target.isPresent() && postUrl.matcher(target.get()).lookingAt()) {
                return Optional.of(Links.canonicalize(target.get()));
            }
        }

        return Optional.empty();
    }
}
