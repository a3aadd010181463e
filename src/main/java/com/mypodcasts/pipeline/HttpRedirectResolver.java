package com.mypodcasts.pipeline;

import com.mypodcasts.config.ProcessorConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.util.Optional;

/**
 * Redirect resolver issuing a GET request and reading the Location header.
 */
public class HttpRedirectResolver implements RedirectResolver {
    private static final Logger log = LogManager.getLogger(HttpRedirectResolver.class);

    /**
     * Connect and read timeout in milliseconds.
     */
    private final int timeout;

    /**
     * User-Agent header value.
     */
    private final String userAgent;

    /**
     * Constructs a new HttpRedirectResolver instance.
     *
     * @param config ProcessorConfig instance.
     */
    public HttpRedirectResolver(ProcessorConfig config) {
        this.timeout = Math.toIntExact(config.getRedirectTimeout() * 1000L);
        this.userAgent = config.getUserAgent();
    }

    @Override
    public Optional<String> resolveOnce(String url) {
        try {
            URI uri = URI.create(url);
            HttpURLConnection conn = (HttpURLConnection) uri.toURL().openConnection();
            try {
                conn.setInstanceFollowRedirects(false);
                conn.setRequestMethod("GET");
                conn.setConnectTimeout(timeout);
                conn.setReadTimeout(timeout);
                conn.setRequestProperty("User-Agent", userAgent);

                int statusCode = conn.getResponseCode();
                String location = conn.getHeaderField("Location");
                log.debug("Resolved {} with {} to {}", url, statusCode, location);

                if (location == null || location.isEmpty()) {
                    return Optional.empty();
                }

                if (location.startsWith("/")) {
                    return Optional.of(uri.getScheme() + "://" + uri.getRawAuthority() + location);
                }

                return Optional.of(location);
            } finally {
                conn.disconnect();
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Unable to resolve redirect of {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
