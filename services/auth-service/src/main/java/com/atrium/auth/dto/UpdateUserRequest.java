package com.atrium.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of operator-controlled user flags; null fields are left as they are.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserRequest {

    @JsonProperty("is_active")
    private Boolean active;

    @JsonProperty("is_admin")
    private Boolean admin;

    private Map<String, Object> permissions;
}
