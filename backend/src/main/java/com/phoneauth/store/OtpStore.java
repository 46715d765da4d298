package com.phoneauth.store;

import com.phoneauth.phone.PhoneNumber;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Volatile storage of pending one-time codes, one record per phone number.
 *
 * Implementations live in a cache shared by every service instance. Each method
 * is a single atomic store operation; conditional methods act only on the
 * issuance identified by {@code issuedAt} (and, for consumption, the code hash),
 * so no caller ever decides a security outcome with a separate read and write.
 *
 * All methods throw {@link com.phoneauth.exception.AuthException} with
 * STORE_UNAVAILABLE when the cache cannot be reached in time.
 */
public interface OtpStore {

    /**
     * Store a record, replacing any previous record of the same phone.
     *
     * @param record    the record to store
     * @param retention how long the cache keeps the record
     */
    void save(OtpRecord record, Duration retention);

    /**
     * Look up the pending record of a phone number.
     *
     * @param phone the phone number
     * @return the record, or empty if none is pending
     */
    Optional<OtpRecord> find(PhoneNumber phone);

    /**
     * Delete the record if it is still the given issuance with the given hash.
     *
     * @param phone    the phone number
     * @param codeHash hash the caller matched
     * @param issuedAt issuance the caller read
     * @return true if this call deleted the record
     */
    boolean consume(PhoneNumber phone, byte[] codeHash, Instant issuedAt);

    /**
     * Decrement the remaining attempts of the given issuance, deleting the
     * record when none remain. The stored record must still carry both the
     * hash and the issuance instant the caller read.
     *
     * @param phone    the phone number
     * @param codeHash hash of the record the caller checked against
     * @param issuedAt issuance the caller read
     * @return attempts remaining after the decrement, or -1 if the issuance is gone
     */
    int recordFailedAttempt(PhoneNumber phone, byte[] codeHash, Instant issuedAt);

    /**
     * Delete the record if it is still the given issuance.
     *
     * @param phone    the phone number
     * @param issuedAt issuance the caller read
     * @return true if this call deleted the record
     */
    boolean evict(PhoneNumber phone, Instant issuedAt);
}
