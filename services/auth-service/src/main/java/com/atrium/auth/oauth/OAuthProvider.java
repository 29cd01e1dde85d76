package com.atrium.auth.oauth;

import java.util.Arrays;
import java.util.Optional;

/**
 * Third-party identity providers a user can log in through.
 */
public enum OAuthProvider {
    GITHUB("github"),
    GOOGLE("google");

    private final String tag;

    OAuthProvider(String tag) {
        this.tag = tag;
    }

    /**
     * @return the lower-case tag used in URLs, state values and the users table
     */
    public String tag() {
        return tag;
    }

    public static Optional<OAuthProvider> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(p -> p.tag.equals(tag))
                .findFirst();
    }
}
