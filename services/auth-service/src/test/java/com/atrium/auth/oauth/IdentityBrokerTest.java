package com.atrium.auth.oauth;

import com.atrium.auth.config.AtriumAuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class IdentityBrokerTest {

    private static final String CALLBACK = "http://localhost:8008/callback/github";

    private MockRestServiceServer server;
    private IdentityBroker broker;

    @BeforeEach
    void setUp() {
        AtriumAuthProperties properties = new AtriumAuthProperties();
        properties.getOauth().getGithub().setClientId("gh-id");
        properties.getOauth().getGithub().setClientSecret("gh-secret");
        properties.getOauth().getGoogle().setClientId("g-id");
        properties.getOauth().getGoogle().setClientSecret("g-secret");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient restClient = builder.build();

        broker = new IdentityBroker(List.of(
                new GithubProviderClient(restClient, properties),
                new GoogleProviderClient(restClient, properties)));
    }

    @Test
    void githubExchangeReturnsNormalizedProfile() {
        server.expect(once(), requestTo(GithubProviderClient.TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of("code", "abc", "client_id", "gh-id")))
                .andRespond(withSuccess("{\"access_token\":\"gho_token\",\"token_type\":\"bearer\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GithubProviderClient.USER_URL))
                .andExpect(header("Authorization", "Bearer gho_token"))
                .andRespond(withSuccess("{\"id\":4242,\"login\":\"octo\",\"name\":\"Octo Cat\","
                                + "\"email\":\"octo@example.com\",\"avatar_url\":\"https://avatars.test/octo\"}",
                        MediaType.APPLICATION_JSON));

        Optional<ProviderProfile> profile = broker.exchangeCode(OAuthProvider.GITHUB, "abc", CALLBACK);

        assertThat(profile).isPresent();
        assertThat(profile.get().getProviderId()).isEqualTo("4242");
        assertThat(profile.get().getUsername()).isEqualTo("octo");
        assertThat(profile.get().getEmail()).isEqualTo("octo@example.com");
        assertThat(profile.get().getFullName()).isEqualTo("Octo Cat");
        assertThat(profile.get().getAvatarUrl()).isEqualTo("https://avatars.test/octo");
        assertThat(profile.get().getRawProfile()).containsEntry("login", "octo");
        server.verify();
    }

    @Test
    void githubPrivateEmailFallsBackToPrimaryVerifiedAddress() {
        server.expect(once(), requestTo(GithubProviderClient.TOKEN_URL))
                .andRespond(withSuccess("{\"access_token\":\"gho_token\"}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GithubProviderClient.USER_URL))
                .andRespond(withSuccess("{\"id\":7,\"login\":\"quiet\",\"email\":null}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GithubProviderClient.EMAILS_URL))
                .andRespond(withSuccess("[{\"email\":\"old@example.com\",\"primary\":false,\"verified\":true},"
                                + "{\"email\":\"unverified@example.com\",\"primary\":true,\"verified\":false},"
                                + "{\"email\":\"quiet@example.com\",\"primary\":true,\"verified\":true}]",
                        MediaType.APPLICATION_JSON));

        Optional<ProviderProfile> profile = broker.exchangeCode(OAuthProvider.GITHUB, "abc", CALLBACK);

        assertThat(profile).map(ProviderProfile::getEmail).contains("quiet@example.com");
        server.verify();
    }

    @Test
    void githubAccountWithoutVerifiedEmailIsRejected() {
        server.expect(once(), requestTo(GithubProviderClient.TOKEN_URL))
                .andRespond(withSuccess("{\"access_token\":\"gho_token\"}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GithubProviderClient.USER_URL))
                .andRespond(withSuccess("{\"id\":7,\"login\":\"quiet\"}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GithubProviderClient.EMAILS_URL))
                .andRespond(withSuccess("[{\"email\":\"x@example.com\",\"primary\":true,\"verified\":false}]",
                        MediaType.APPLICATION_JSON));

        assertThat(broker.exchangeCode(OAuthProvider.GITHUB, "abc", CALLBACK)).isEmpty();
    }

    @Test
    void tokenResponseWithoutAccessTokenFailsWithoutProfileCall() {
        server.expect(once(), requestTo(GithubProviderClient.TOKEN_URL))
                .andRespond(withSuccess("{\"error\":\"bad_verification_code\"}", MediaType.APPLICATION_JSON));

        assertThat(broker.exchangeCode(OAuthProvider.GITHUB, "stale", CALLBACK)).isEmpty();
        server.verify();
    }

    @Test
    void providerServerErrorFailsWithoutRetry() {
        server.expect(once(), requestTo(GithubProviderClient.TOKEN_URL))
                .andRespond(withServerError());

        assertThat(broker.exchangeCode(OAuthProvider.GITHUB, "abc", CALLBACK)).isEmpty();
        server.verify();
    }

    @Test
    void transportFailureIsRetriedOnce() {
        server.expect(once(), requestTo(GoogleProviderClient.TOKEN_URL))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });
        server.expect(once(), requestTo(GoogleProviderClient.TOKEN_URL))
                .andExpect(content().formDataContains(Map.of("grant_type", "authorization_code")))
                .andRespond(withSuccess("{\"access_token\":\"ya29.token\"}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(GoogleProviderClient.USERINFO_URL))
                .andRespond(withSuccess("{\"id\":\"1098\",\"email\":\"jane.doe@example.com\","
                                + "\"name\":\"Jane Doe\",\"picture\":\"https://photos.test/jane\"}",
                        MediaType.APPLICATION_JSON));

        Optional<ProviderProfile> profile = broker.exchangeCode(OAuthProvider.GOOGLE, "abc",
                "http://localhost:8008/callback/google");

        assertThat(profile).isPresent();
        assertThat(profile.get().getUsername()).isEqualTo("jane.doe");
        assertThat(profile.get().getAvatarUrl()).isEqualTo("https://photos.test/jane");
        server.verify();
    }

    @Test
    void secondTransportFailureGivesUp() {
        server.expect(once(), requestTo(GoogleProviderClient.TOKEN_URL))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });
        server.expect(once(), requestTo(GoogleProviderClient.TOKEN_URL))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThat(broker.exchangeCode(OAuthProvider.GOOGLE, "abc", "http://localhost:8008/callback/google")).isEmpty();
        server.verify();
    }

    @Test
    void unconfiguredProviderIsUnavailable() {
        AtriumAuthProperties properties = new AtriumAuthProperties();
        IdentityBroker unconfigured = new IdentityBroker(List.of(
                new GithubProviderClient(RestClient.create(), properties)));

        assertThat(unconfigured.isAvailable(OAuthProvider.GITHUB)).isFalse();
        assertThat(unconfigured.isAvailable(OAuthProvider.GOOGLE)).isFalse();
        assertThat(unconfigured.exchangeCode(OAuthProvider.GITHUB, "abc", CALLBACK)).isEmpty();
    }

    @Test
    void authorizationUrlCarriesClientAndState() {
        String url = broker.authorizationUrl(OAuthProvider.GITHUB, CALLBACK, "v1.state");

        assertThat(url).startsWith(GithubProviderClient.AUTHORIZE_URL)
                .contains("client_id=gh-id")
                .contains("state=v1.state")
                .contains("scope=user:email");
    }
}
