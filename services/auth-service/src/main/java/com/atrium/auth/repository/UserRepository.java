package com.atrium.auth.repository;

import com.atrium.auth.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Spring Data JPA derives the queries from the method names:
 * - findByProviderAndProviderId -> the identity a provider login resolves to
 * - findByProviderAndEmailIgnoreCaseAndProviderIdIsNull -> a pre-registered, not yet
 *   bound identity for the same provider and email
 * - existsByEmail / existsByUsername -> uniqueness checks before insert
 *
 * @see User for entity definition
 * @see com.atrium.auth.service.SessionCoordinator for business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find the identity bound to a provider account.
     *
     * @param provider Provider tag ("github", "google", "local")
     * @param providerId Provider-assigned account id
     * @return Optional containing the User if bound, empty otherwise
     */
    Optional<User> findByProviderAndProviderId(String provider, String providerId);

    /**
     * Find a pre-registered identity that has not completed its first login.
     *
     * @param provider Provider tag the admin registered the user under
     * @param email Email address reported by the provider
     * @return Optional containing the pending User, empty if none
     */
    Optional<User> findByProviderAndEmailIgnoreCaseAndProviderIdIsNull(String provider, String email);

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);
}
