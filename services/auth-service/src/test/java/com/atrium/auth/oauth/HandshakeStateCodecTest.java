package com.atrium.auth.oauth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeStateCodecTest {

    private final HandshakeStateCodec codec = new HandshakeStateCodec();

    @Test
    void roundTripsUrlsContainingSeparatorCharacters() {
        HandshakeState state = new HandshakeState(
                codec.newNonce(),
                "https://auth.atrium.test:8443/callback/github?x=a:b|c&y=%3A%7C",
                "https://app.atrium.test/auth/done?next=%2Fhome%3Ftab%3D1|2#frag.ment",
                "github");

        assertThat(codec.unpack(codec.pack(state))).contains(state);
    }

    @Test
    void roundTripsEmptyUrls() {
        HandshakeState state = new HandshakeState(codec.newNonce(), "", "", "google");

        assertThat(codec.unpack(codec.pack(state))).contains(state);
    }

    @Test
    void packedStateIsUrlSafeAndVersioned() {
        String packed = codec.pack(new HandshakeState(
                codec.newNonce(), "https://a.test/cb?q=1 2", "https://b.test/?r=ü", "github"));

        assertThat(packed).startsWith("v1.");
        assertThat(packed).matches("[A-Za-z0-9_.-]+");
    }

    @Test
    void noncesAreFreshAndWellFormed() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String nonce = codec.newNonce();
            assertThat(nonce).hasSize(43).matches("[A-Za-z0-9_-]+");
            assertThat(seen.add(nonce)).isTrue();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "random-state-from-somewhere",
            "v2.a.b.c.d",
            "v1.a.b.c",
            "v1.a.b.c.d.e",
            "v1.***.aGk.aGk.Z2l0aHVi",
            "nonce:https://a.test/cb:https://b.test:github",
            "nonce|https://a.test/cb|https://b.test|github"
    })
    void rejectsMalformedState(String value) {
        assertThat(codec.unpack(value)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"n0nce", "", "nonce.with.dots", "a|b:c%3A", "ünïcode nonce"})
    void roundTripsAnyNonce(String nonce) {
        HandshakeState state = new HandshakeState(nonce, "https://a.test/cb?x=a%3Ab%7Cc", "", "github");

        assertThat(codec.unpack(codec.pack(state))).contains(state);
    }

    @Test
    void rejectsNull() {
        assertThat(codec.unpack(null)).isEmpty();
    }

    @Test
    void decodesHandBuiltState() {
        String value = "v1." + b64("n") + "." + b64("https://a.test") + "." + b64("https://b.test") + "." + b64("google");

        assertThat(codec.unpack(value)).contains(new HandshakeState("n", "https://a.test", "https://b.test", "google"));
    }

    private static String b64(String value) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
