package com.vaultsphere.auth.infrastructure.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw failed-attempt counter per (IP, email) pair.
 * Independent of the per-account lockout; insert-or-increment only.
 */
@Entity
@Table(name = "login_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_login_attempts_ip_email",
                columnNames = {"ip_address", "email"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginAttemptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ip_address", nullable = false, length = 45)
    private String ipAddress;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_attempt", nullable = false)
    private Instant lastAttempt;
}
