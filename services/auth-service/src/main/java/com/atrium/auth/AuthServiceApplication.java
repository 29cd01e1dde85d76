package com.atrium.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Main entry point for the Atrium Authentication Service.
 *
 * This service relays OAuth 2.0 logins and issues the session credentials that
 * downstream Atrium services trust:
 * - User authentication via GitHub and Google OAuth 2.0
 * - Break-glass local credentials for emergency administrative access
 * - Short-lived signed access tokens (JWT, HMAC-SHA256)
 * - Long-lived opaque refresh tokens, stored only as SHA-256 hashes
 * - Administrative pre-registration and user management
 *
 * Architecture Context:
 * - Runs on port 8008 (configured in application.yml)
 * - Connects to PostgreSQL for user and refresh-token persistence
 * - Stateless request handling; the database is the only shared state
 *
 * The Spring application context is the composition root: every component is
 * built once and handed to its collaborators through constructor injection.
 *
 * @see com.atrium.auth.controller.AuthController for the public endpoints
 * @see com.atrium.auth.service.SessionCoordinator for session issuance
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
