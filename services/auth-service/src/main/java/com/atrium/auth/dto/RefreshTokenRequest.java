package com.atrium.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of /refresh and /logout.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshTokenRequest {

    @NotBlank
    @Size(max = 512)
    private String refreshToken;

    @Override
    public String toString() {
        return "RefreshTokenRequest(refreshToken=***)";
    }
}
