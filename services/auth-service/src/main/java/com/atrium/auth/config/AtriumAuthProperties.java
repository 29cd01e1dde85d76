package com.atrium.auth.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code atrium.auth.*} configuration tree.
 *
 * Bound and validated once at startup; a missing JWT secret or a malformed
 * value fails the boot instead of the first request.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "atrium.auth")
public class AtriumAuthProperties {

    /** Public base URL of the frontend; default target for client redirects. */
    @NotBlank
    private String frontendUrl = "http://localhost:3000";

    /** Public base URL of this service; used to build default provider callback URLs. */
    @NotBlank
    private String backendUrl = "http://localhost:8008";

    /** Origins a client redirect may point to. Empty means "the frontend URL only". */
    private List<String> allowedRedirectOrigins = new ArrayList<>();

    @NotNull
    private RegistrationPolicy registrationPolicy = RegistrationPolicy.PRE_REGISTERED;

    /** Domain used for synthesized local-user email addresses. */
    @NotBlank
    private String localEmailDomain = "atrium.local";

    @Valid
    private Jwt jwt = new Jwt();

    @Valid
    private OAuth oauth = new OAuth();

    private Admin admin = new Admin();

    /** Break-glass users keyed by login name. */
    private Map<String, LocalUser> localUsers = new LinkedHashMap<>();

    /** One access log line per request when true. */
    private boolean requestLogging = true;

    public enum RegistrationPolicy {
        /** Unknown OAuth identities are rejected unless an admin pre-registered them. */
        PRE_REGISTERED,
        /** Unknown OAuth identities are created on first login. */
        OPEN
    }

    @Data
    public static class Jwt {
        /** HMAC-SHA256 key material; at least 32 bytes. */
        @NotBlank
        private String secret;

        @Min(1)
        private long accessTokenMinutes = 30;

        @Min(1)
        private long refreshTokenDays = 7;
    }

    @Data
    public static class OAuth {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        private Client github = new Client();

        private Client google = new Client();
    }

    @Data
    public static class Client {
        private String clientId;
        private String clientSecret;

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }
    }

    @Data
    public static class Admin {
        /** Static bearer value guarding /admin/**. Blank disables the admin surface. */
        private String apiToken;
    }

    @Data
    public static class LocalUser {
        /** Lower-case hex SHA-256 of the password. */
        private String passwordHash;
        private boolean admin;
        /** Permission set copied into the user, e.g. {@code services: ["*"]}. */
        private Map<String, List<String>> permissions = new HashMap<>();
        private String email;
        private String fullName;
    }
}
