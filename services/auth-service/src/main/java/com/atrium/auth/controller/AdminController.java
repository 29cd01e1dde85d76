package com.atrium.auth.controller;

import com.atrium.auth.dto.PreRegisterRequest;
import com.atrium.auth.dto.UpdateUserRequest;
import com.atrium.auth.dto.UserResponse;
import com.atrium.auth.service.UserAdministrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints, authenticated by the static admin API token
 * (see {@link com.atrium.auth.security.AdminApiTokenFilter}).
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final UserAdministrationService userAdministrationService;

    /**
     * Create a user ahead of their first login so the PRE_REGISTERED policy
     * admits them.
     *
     * @param request email, provider and optional username, admin flag and permissions
     * @return 201 with the created user; 400 for an unknown provider,
     *         409 if the email or username is taken
     */
    @PostMapping("/pre-register")
    public ResponseEntity<UserResponse> preRegister(@Valid @RequestBody PreRegisterRequest request) {
        var user = userAdministrationService.preRegister(
                request.getEmail(),
                request.getProvider(),
                request.getUsername(),
                request.getFullName(),
                request.isAdmin(),
                request.getPermissions());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /** All users, oldest first. */
    @GetMapping("/users")
    public List<UserResponse> listUsers() {
        return userAdministrationService.listUsers().stream()
                .map(UserResponse::from)
                .toList();
    }

    /**
     * @return the user, or 404 if there is none with this id
     */
    @GetMapping("/users/{id}")
    public UserResponse getUser(@PathVariable UUID id) {
        return UserResponse.from(userAdministrationService.getUser(id));
    }

    /**
     * Update active flag, admin flag or permissions; absent fields are left
     * as they are.
     */
    @PatchMapping("/users/{id}")
    public UserResponse updateUser(@PathVariable UUID id, @RequestBody UpdateUserRequest request) {
        return UserResponse.from(userAdministrationService.updateUser(
                id, request.getActive(), request.getAdmin(), request.getPermissions()));
    }

    /**
     * Delete a user with all of their refresh credentials.
     *
     * @return 204 No Content, or 404 if there is no such user
     */
    @DeleteMapping("/users/{id}")
    public ResponseEntity<Void> deleteUser(@PathVariable UUID id) {
        userAdministrationService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
