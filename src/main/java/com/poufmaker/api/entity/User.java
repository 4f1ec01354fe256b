package com.poufmaker.api.entity;

import com.poufmaker.api.enums.UserRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users") // "user" is reserved in PostgreSQL
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false)
    private String fullName;

    private String phoneNumber;

    @Column(nullable = false, length = 60) // BCrypt hash length
    private String passwordHash;

    @Enumerated(EnumType.STRING) @Builder.Default
    @Column(nullable = false, length = 20)
    private UserRole role = UserRole.CLIENT;

    @Builder.Default
    @Column(nullable = false)
    private boolean emailConfirmed = false;

    private String confirmationToken;

    private String resetPasswordToken;

    private Instant resetPasswordExpiry;

    private Instant lastLoginDate;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
