package com.mypodcasts.pipeline;

import java.util.Optional;

/**
 * Resolves one redirect hop.
 */
@FunctionalInterface
public interface RedirectResolver {

    /**
     * Resolver that never finds a redirect.
     */
    RedirectResolver NONE = url -> Optional.empty();

    /**
     * Gets where the URL redirects to without following further.
     * <p>Implementations report failures as no redirect.
     *
     * @param url URL string.
     * @return Optional of absolute location.
     */
    Optional<String> resolveOnce(String url);
}
