package com.atrium.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where to send the user for consent, and the state the client should expect
 * back on the callback.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginInitiationResponse {
    private String authUrl;
    private String state;
}
