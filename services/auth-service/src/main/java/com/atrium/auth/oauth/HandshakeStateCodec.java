package com.atrium.auth.oauth;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Packs a {@link HandshakeState} into the OAuth {@code state} parameter and back.
 *
 * Wire format (version 1):
 * <pre>
 * v1.&lt;nonce&gt;.&lt;callback url&gt;.&lt;client redirect url&gt;.&lt;provider&gt;
 * </pre>
 * Every field is unpadded base64url. The '.' separator is outside the
 * base64url alphabet, so a field can never contain it whatever the URLs hold,
 * and the whole value needs no further escaping in a query string or redirect.
 * An empty field encodes to an empty segment.
 *
 * State is not stored server-side. Its only secret is the nonce, which the
 * client compares with the value it received from login initiation.
 */
@Component
public class HandshakeStateCodec {

    static final String VERSION = "v1";
    private static final String SEPARATOR = ".";
    private static final int FIELD_COUNT = 5;
    private static final int NONCE_BYTES = 32;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecureRandom random = new SecureRandom();

    /**
     * @return a fresh 256-bit nonce, base64url encoded (43 characters)
     */
    public String newNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    public String pack(HandshakeState state) {
        return String.join(SEPARATOR,
                VERSION,
                encode(state.getNonce()),
                encode(state.getProviderCallbackUrl()),
                encode(state.getClientRedirectUrl()),
                encode(state.getProviderTag()));
    }

    /**
     * Decode a state value.
     *
     * Any value produced by {@link #pack} decodes back to the same four
     * fields; the nonce is carried, not interpreted.
     *
     * @return the decoded state, or empty if the version tag, field count or
     *         base64 encoding is wrong
     */
    public Optional<HandshakeState> unpack(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = value.split(Pattern.quote(SEPARATOR), -1);
        if (parts.length != FIELD_COUNT || !VERSION.equals(parts[0])) {
            return Optional.empty();
        }
        try {
            return Optional.of(new HandshakeState(
                    decode(parts[1]), decode(parts[2]), decode(parts[3]), decode(parts[4])));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String encode(String field) {
        return ENCODER.encodeToString((field == null ? "" : field).getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String field) {
        return new String(DECODER.decode(field), StandardCharsets.UTF_8);
    }
}
