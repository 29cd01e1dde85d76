package com.atrium.auth.oauth;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A provider account, normalized across providers.
 *
 * {@code rawProfile} is the provider's userinfo payload as received; it is
 * stored verbatim and never interpreted.
 */
@Value
@Builder
public class ProviderProfile {
    OAuthProvider provider;
    String providerId;
    String email;
    String username;
    String fullName;
    String avatarUrl;
    Map<String, Object> rawProfile;
}
