package com.phoneauth.repository;

import com.phoneauth.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for User entity operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find a user by canonical phone number.
     *
     * @param phone the E.164 phone number
     * @return Optional containing the user if found, empty otherwise
     */
    Optional<User> findByPhone(String phone);
}
