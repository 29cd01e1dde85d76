package com.atrium.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * User - JPA Entity representing a principal known to the Atrium platform.
 *
 * This entity maps to the 'users' table and is the identity every issued
 * credential is bound to.
 *
 * Table Schema (from V1__initial_schema.sql):
 * - id: UUID primary key
 * - email / username: each globally unique
 * - provider / provider_id: which broker authenticated the user ('github',
 *   'google', 'local') and the provider-assigned id; the pair is unique
 * - provider_data: raw provider profile payload (JSON text)
 * - is_active / is_admin / permissions: operator-controlled flags
 * - created_at / updated_at / last_login: timestamps
 *
 * Lifecycle:
 * - Created on first successful provider login (subject to the registration
 *   policy), on first local-credential login, or by admin pre-registration
 * - Profile fields refreshed on every later login through the same provider
 *   and provider id; username, admin flag and permissions are never touched
 *   by a provider login
 * - Deleted only through the admin API
 *
 * @see com.atrium.auth.repository.UserRepository for database operations
 * @see com.atrium.auth.service.SessionCoordinator for creation and update logic
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    /** Provider tag for identities created through the break-glass path. */
    public static final String LOCAL_PROVIDER = "local";

    @Id
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;

    @Column(name = "email", unique = true, nullable = false)
    private String email;

    @Column(name = "username", unique = true, nullable = false, length = 100)
    private String username;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    /**
     * Which broker authenticated this user: "github", "google" or "local".
     */
    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    /**
     * Provider-assigned account id.
     *
     * Null for a pre-registered user who has not logged in yet; the first
     * successful provider login binds it.
     */
    @Column(name = "provider_id")
    private String providerId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "provider_data")
    private Map<String, Object> providerData;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_admin", nullable = false)
    private boolean admin = false;

    /**
     * Service-specific permission set. Opaque to this service: it is copied
     * into access tokens and interpreted only by downstream services.
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "permissions")
    private Map<String, Object> permissions;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_login")
    private Instant lastLogin;

    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
