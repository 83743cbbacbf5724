package com.sams.authservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "users")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, updatable = false, length = 50)
    private String username;

    /** Stored trimmed and lower-cased; the token subject. */
    @Column(unique = true, nullable = false, length = 255)
    private String email;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "hashed_password", nullable = false)
    private String passwordHash;

    @Column(nullable = false, length = 50)
    @Builder.Default
    private Role role = Role.USER;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /** Optional link to a staff member record owned by another service. */
    @Column(name = "staff_id")
    private Long staffId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
