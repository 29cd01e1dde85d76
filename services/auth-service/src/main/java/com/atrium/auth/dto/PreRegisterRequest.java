package com.atrium.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Admin request to allow a provider account in before its first login.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PreRegisterRequest {

    @NotBlank
    @Email
    private String email;

    /** "github" or "google". */
    @NotBlank
    private String provider;

    /** Defaults to the local part of the email. */
    @Pattern(regexp = "[A-Za-z0-9_.-]{1,100}")
    private String username;

    @Size(max = 255)
    private String fullName;

    @JsonProperty("is_admin")
    private boolean admin;

    private Map<String, Object> permissions;
}
