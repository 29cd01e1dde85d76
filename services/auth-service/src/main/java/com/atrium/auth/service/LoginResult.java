package com.atrium.auth.service;

import com.atrium.auth.entity.User;
import lombok.Value;

/** The user a login resolved to, with the credentials issued for it. */
@Value
public class LoginResult {
    User user;
    SessionTokens tokens;
}
