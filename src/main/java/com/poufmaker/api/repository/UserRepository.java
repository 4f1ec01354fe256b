package com.poufmaker.api.repository;

import com.poufmaker.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    Optional<User> findByConfirmationTokenAndEmailConfirmedFalse(String confirmationToken);

    Optional<User> findByResetPasswordTokenAndResetPasswordExpiryAfter(String resetPasswordToken, Instant now);
}
