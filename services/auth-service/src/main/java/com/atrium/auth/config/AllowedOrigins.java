package com.atrium.auth.config;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The origins a browser may be sent back to, and may call this service from.
 *
 * Built once from {@code atrium.auth.frontend-url} plus
 * {@code atrium.auth.allowed-redirect-origins}; every entry is normalized to
 * {@code scheme://host[:port]} in lower case, so redirect checks and CORS
 * agree on what an origin is. An entry that is not an absolute http(s) URL
 * fails startup.
 */
@Component
public class AllowedOrigins {

    private final List<String> origins;

    public AllowedOrigins(AtriumAuthProperties properties) {
        List<String> normalized = new ArrayList<>();
        String frontendOrigin = originOf(properties.getFrontendUrl() == null ? null : properties.getFrontendUrl().trim());
        if (frontendOrigin == null) {
            throw new IllegalStateException("atrium.auth.frontend-url must be an absolute http(s) URL");
        }
        normalized.add(frontendOrigin);
        for (String configured : properties.getAllowedRedirectOrigins()) {
            String origin = originOf(configured == null ? null : configured.trim());
            if (origin == null) {
                throw new IllegalStateException("atrium.auth.allowed-redirect-origins: invalid origin '" + configured + "'");
            }
            if (!normalized.contains(origin)) {
                normalized.add(origin);
            }
        }
        this.origins = List.copyOf(normalized);
    }

    /**
     * @return whether {@code url} is an absolute http(s) URL on one of the allowed origins
     */
    public boolean permits(String url) {
        String origin = originOf(url);
        return origin != null && origins.contains(origin);
    }

    /**
     * @return normalized origins, frontend first
     */
    public List<String> asList() {
        return origins;
    }

    /**
     * Origin of a URL.
     *
     * The URL is parsed as given: surrounding whitespace or any other
     * character that is not legal in a URI makes it invalid.
     *
     * @return "scheme://host[:port]" in lower case, or null if {@code url} is
     *         not an absolute http(s) URL
     */
    public static String originOf(String url) {
        if (url == null || url.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            String origin = scheme.toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT);
            return uri.getPort() == -1 ? origin : origin + ":" + uri.getPort();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
