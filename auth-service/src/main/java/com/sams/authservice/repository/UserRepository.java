package com.sams.authservice.repository;

import com.sams.authservice.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Credential store lookups. Callers pass emails already normalized by
 * {@link com.sams.authservice.util.EmailAddresses#normalize(String)}.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);
}
