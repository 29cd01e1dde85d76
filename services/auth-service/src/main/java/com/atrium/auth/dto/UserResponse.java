package com.atrium.auth.dto;

import com.atrium.auth.entity.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * UserResponse - public projection of a {@link User}.
 *
 * Provider payloads are never exposed; they stay in the database for
 * operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private UUID id;
    private String email;
    private String username;
    private String fullName;
    private String avatarUrl;
    private String provider;

    @JsonProperty("is_active")
    private boolean active;

    @JsonProperty("is_admin")
    private boolean admin;

    private Map<String, Object> permissions;
    private Instant createdAt;
    private Instant lastLogin;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .fullName(user.getFullName())
                .avatarUrl(user.getAvatarUrl())
                .provider(user.getProvider())
                .active(user.isActive())
                .admin(user.isAdmin())
                .permissions(user.getPermissions())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .build();
    }
}
