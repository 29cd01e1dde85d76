package com.atrium.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * BackupLoginRequest - payload for break-glass username/password login.
 *
 * Usage:
 * <pre>
 * POST /backup-login
 * Content-Type: application/json
 *
 * {
 *   "username": "admin",
 *   "password": "correct horse battery",
 *   "email": "ops@example.com",
 *   "full_name": "On-call Operator"
 * }
 * </pre>
 *
 * {@code email} and {@code full_name} only take effect when the local
 * identity is created by this login.
 *
 * Security Note: never log or persist the password field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupLoginRequest {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_.-]{1,50}")
    private String username;

    @NotBlank
    @Size(min = 8, max = 100)
    private String password;

    @Email
    private String email;

    @Size(max = 255)
    private String fullName;

    @Override
    public String toString() {
        return "BackupLoginRequest(username=" + username + ")";
    }
}
