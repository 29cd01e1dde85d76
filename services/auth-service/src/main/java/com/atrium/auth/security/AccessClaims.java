package com.atrium.auth.security;

import lombok.Builder;
import lombok.Value;
import org.springframework.security.core.AuthenticatedPrincipal;

import java.util.Map;
import java.util.UUID;

/**
 * The identity assertion carried by an access token.
 *
 * Admin flag and permissions are a snapshot taken when the token was minted;
 * downstream services see changes only after the next renewal.
 */
@Value
@Builder
public class AccessClaims implements AuthenticatedPrincipal {

    UUID userId;
    String email;
    String username;
    boolean admin;
    Map<String, Object> permissions;

    /**
     * Principal name as seen through {@link java.security.Principal#getName()}:
     * the user id.
     */
    @Override
    public String getName() {
        return userId.toString();
    }
}
