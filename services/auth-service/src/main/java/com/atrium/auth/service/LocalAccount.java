package com.atrium.auth.service;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A break-glass account whose password has already been checked, with the
 * profile values its identity should be created with.
 */
@Value
@Builder
public class LocalAccount {
    String loginName;
    String username;
    String email;
    String fullName;
    boolean admin;
    Map<String, Object> permissions;
}
