package com.atrium.auth.oauth;

import com.atrium.auth.config.AtriumAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Google OAuth 2.0 login.
 *
 * Google profiles carry no username, so one is derived from the local part
 * of the account email.
 */
@Slf4j
@Component
public class GoogleProviderClient extends AbstractIdentityProviderClient {

    static final String AUTHORIZE_URL = "https://accounts.google.com/o/oauth2/auth";
    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";
    static final String USERINFO_URL = "https://www.googleapis.com/oauth2/v2/userinfo";

    public GoogleProviderClient(RestClient oauthRestClient, AtriumAuthProperties properties) {
        super(oauthRestClient, properties.getOauth().getGoogle());
    }

    @Override
    public OAuthProvider provider() {
        return OAuthProvider.GOOGLE;
    }

    @Override
    public String authorizationUrl(String redirectUri, String state) {
        return UriComponentsBuilder.fromHttpUrl(AUTHORIZE_URL)
                .queryParam("client_id", client.getClientId())
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", "openid email profile")
                .queryParam("response_type", "code")
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
        form.add("grant_type", "authorization_code");
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
            log.warn("Google token response carried no access_token (error={})", stringField(response, "error"));
        }
        return Optional.ofNullable(accessToken);
    }

    @Override
    public Optional<ProviderProfile> fetchProfile(String accessToken) {
        Map<String, Object> user = withRetry("userinfo lookup", () -> restClient.get()
                .uri(USERINFO_URL)
                .headers(headers -> headers.setBearerAuth(accessToken))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JSON_OBJECT));

        String id = stringField(user, "id");
        String email = stringField(user, "email");
        if (id == null || email == null) {
            log.warn("Google userinfo response missing id or email");
            return Optional.empty();
        }

        return Optional.of(ProviderProfile.builder()
                .provider(OAuthProvider.GOOGLE)
                .providerId(id)
                .email(email)
                .username(localPart(email))
                .fullName(stringField(user, "name"))
                .avatarUrl(stringField(user, "picture"))
                .rawProfile(user)
                .build());
    }

    static String localPart(String email) {
        int at = email.indexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }
}
