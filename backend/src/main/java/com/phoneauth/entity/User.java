package com.phoneauth.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * User identity keyed by phone number.
 *
 * Created lazily on the first successful OTP login. The phone number is stored
 * in canonical E.164 form and is unique, which also settles concurrent first
 * logins of the same number.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_phone", columnList = "phone", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Canonical E.164 phone number. Must be unique and not null.
     */
    @Column(name = "phone", nullable = false, unique = true, length = 16)
    private String phone;

    /**
     * Set once the owner has proven control of the number with an OTP.
     */
    @Column(name = "phone_verified", nullable = false)
    private Boolean phoneVerified = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Constructor for creating a new user with phone and verification status.
     *
     * @param phone the canonical phone number
     * @param phoneVerified whether the phone number is verified
     */
    public User(String phone, Boolean phoneVerified) {
        this.phone = phone;
        this.phoneVerified = phoneVerified;
    }
}
