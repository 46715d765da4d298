package com.phoneauth.store;

import com.phoneauth.phone.PhoneNumber;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Pending one-time code for a phone number.
 *
 * Only the keyed hash of the code is held; the plaintext never reaches the store.
 * {@code issuedAt} identifies the issuance, and every conditional mutation in
 * {@link OtpStore} is scoped to it so that a reissue is never touched by a
 * verification that read the previous record.
 */
public record OtpRecord(
        PhoneNumber phone,
        byte[] codeHash,
        Instant expiresAt,
        int attemptsRemaining,
        Instant issuedAt
) {

    public OtpRecord {
        Objects.requireNonNull(phone, "phone");
        Objects.requireNonNull(codeHash, "codeHash");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(issuedAt, "issuedAt");
        codeHash = codeHash.clone();
    }

    @Override
    public byte[] codeHash() {
        return codeHash.clone();
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OtpRecord other)) {
            return false;
        }
        return attemptsRemaining == other.attemptsRemaining
                && phone.equals(other.phone)
                && Arrays.equals(codeHash, other.codeHash)
                && expiresAt.equals(other.expiresAt)
                && issuedAt.equals(other.issuedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(phone, expiresAt, attemptsRemaining, issuedAt);
        return 31 * result + Arrays.hashCode(codeHash);
    }

    @Override
    public String toString() {
        return "OtpRecord[phone=" + phone + ", expiresAt=" + expiresAt
                + ", attemptsRemaining=" + attemptsRemaining + ", issuedAt=" + issuedAt + "]";
    }
}
