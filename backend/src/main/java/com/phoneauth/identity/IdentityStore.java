package com.phoneauth.identity;

import com.phoneauth.phone.PhoneNumber;

import java.util.UUID;

/**
 * Durable user records, as seen by the authentication core.
 */
public interface IdentityStore {

    /**
     * Resolve the user owning a verified phone number, creating the user on
     * first login.
     *
     * @param phone the canonical phone number, already proven by OTP
     * @return the user id
     * @throws com.phoneauth.exception.AuthException IDENTITY_STORE_UNAVAILABLE
     *         if the store cannot be reached
     */
    UUID resolveOrCreate(PhoneNumber phone);
}
