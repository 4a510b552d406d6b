package com.kaimu.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.modules.auth.domain.User;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByUsername(String username);

    boolean existsByUsername(String username);

    Optional<User> findFirstByEmailIgnoreCaseAndEmailVerifiedTrueOrderByCreatedAtAsc(String email);
}
