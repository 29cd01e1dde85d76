package com.atrium.auth.oauth;

import com.atrium.auth.config.AtriumAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GitHub OAuth App login.
 *
 * GitHub answers a bad code with 200 and an {@code error} field instead of an
 * access token, so a missing token is the failure signal. Accounts that keep
 * their email private get the primary verified address from /user/emails.
 */
@Slf4j
@Component
public class GithubProviderClient extends AbstractIdentityProviderClient {

    static final String AUTHORIZE_URL = "https://github.com/login/oauth/authorize";
    static final String TOKEN_URL = "https://github.com/login/oauth/access_token";
    static final String USER_URL = "https://api.github.com/user";
    static final String EMAILS_URL = "https://api.github.com/user/emails";

    public GithubProviderClient(RestClient oauthRestClient, AtriumAuthProperties properties) {
        super(oauthRestClient, properties.getOauth().getGithub());
    }

    @Override
    public OAuthProvider provider() {
        return OAuthProvider.GITHUB;
    }

    @Override
    public String authorizationUrl(String redirectUri, String state) {
        return UriComponentsBuilder.fromHttpUrl(AUTHORIZE_URL)
                .queryParam("client_id", client.getClientId())
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", "user:email")
                .queryParam("state", state)
                .build()
                .encode()
                .toUriString();
    }

    @Override
    public Optional<String> exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", client.getClientId());
        form.add("client_secret", client.getClientSecret());
        form.add("code", code);
        form.add("redirect_uri", redirectUri);

        Map<String, Object> response = withRetry("token exchange", () -> restClient.post()
                .uri(TOKEN_URL)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(JSON_OBJECT));

        String accessToken = stringField(response, "access_token");
        if (accessToken == null) {
            log.warn("GitHub token response carried no access_token (error={})", stringField(response, "error"));
        }
        return Optional.ofNullable(accessToken);
    }

    @Override
    public Optional<ProviderProfile> fetchProfile(String accessToken) {
        Map<String, Object> user = withRetry("user lookup", () -> restClient.get()
                .uri(USER_URL)
                .headers(headers -> headers.setBearerAuth(accessToken))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JSON_OBJECT));

        String id = stringField(user, "id");
        String login = stringField(user, "login");
        if (id == null || login == null) {
            log.warn("GitHub user response missing id or login");
            return Optional.empty();
        }

        String email = stringField(user, "email");
        if (email == null) {
            email = primaryVerifiedEmail(accessToken);
        }
        if (email == null) {
            log.warn("GitHub account {} has no primary verified email", id);
            return Optional.empty();
        }

        return Optional.of(ProviderProfile.builder()
                .provider(OAuthProvider.GITHUB)
                .providerId(id)
                .email(email)
                .username(login)
                .fullName(stringField(user, "name"))
                .avatarUrl(stringField(user, "avatar_url"))
                .rawProfile(user)
                .build());
    }

    private String primaryVerifiedEmail(String accessToken) {
        List<Map<String, Object>> emails = withRetry("email lookup", () -> restClient.get()
                .uri(EMAILS_URL)
                .headers(headers -> headers.setBearerAuth(accessToken))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JSON_ARRAY));
        if (emails == null) {
            return null;
        }
        return emails.stream()
                .filter(e -> Boolean.TRUE.equals(e.get("primary")) && Boolean.TRUE.equals(e.get("verified")))
                .map(e -> stringField(e, "email"))
                .filter(e -> e != null)
                .findFirst()
                .orElse(null);
    }
}
