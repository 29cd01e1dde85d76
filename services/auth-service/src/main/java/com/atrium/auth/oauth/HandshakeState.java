package com.atrium.auth.oauth;

import lombok.Value;

/**
 * What the OAuth round-trip carries from login initiation to callback.
 *
 * {@code providerTag} is kept as the raw tag so a state that names an
 * unknown provider still decodes and can be rejected by the caller.
 */
@Value
public class HandshakeState {
    String nonce;
    String providerCallbackUrl;
    String clientRedirectUrl;
    String providerTag;
}
