package com.phoneauth.identity;

import com.phoneauth.entity.User;
import com.phoneauth.exception.AuthException;
import com.phoneauth.phone.PhoneNumber;
import com.phoneauth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Identity store over the {@code users} table.
 *
 * Lookup, creation and the verified flag update are separate repository
 * transactions. Two first logins of the same number race on the unique phone
 * index; the loser re-reads the winner's row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaIdentityStore implements IdentityStore {

    private final UserRepository userRepository;

    @Override
    public UUID resolveOrCreate(PhoneNumber phone) {
        try {
            return userRepository.findByPhone(phone.value())
                    .map(this::markVerified)
                    .orElseGet(() -> create(phone));
        } catch (DataAccessException ex) {
            log.error("Identity store unavailable while resolving {}: {}", phone, ex.getMessage());
            throw AuthException.identityStoreUnavailable(ex);
        }
    }

    private UUID create(PhoneNumber phone) {
        try {
            User user = userRepository.saveAndFlush(new User(phone.value(), true));
            log.info("Created user {} for {}", user.getId(), phone);
            return user.getId();
        } catch (DataIntegrityViolationException ex) {
            log.debug("Concurrent first login for {}, reading existing user", phone);
            return userRepository.findByPhone(phone.value())
                    .map(User::getId)
                    .orElseThrow(() -> ex);
        }
    }

    private UUID markVerified(User user) {
        if (!Boolean.TRUE.equals(user.getPhoneVerified())) {
            user.setPhoneVerified(true);
            userRepository.save(user);
            log.info("Marked phone of user {} as verified", user.getId());
        }
        return user.getId();
    }
}
