package com.phoneauth.exception;

import java.time.Duration;

/**
 * Exception thrown by the authentication core for every failure in the
 * {@link AuthErrorCode} taxonomy.
 *
 * The message is always the generic message of the code; callers never see
 * OTP values, hashes or parser diagnostics. Causes are kept for logging.
 *
 * GlobalExceptionHandler maps this to the status of the code with RFC 7807 format.
 *
 * @see com.phoneauth.exception.GlobalExceptionHandler
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;
    private final Duration retryAfter;

    /**
     * Constructs a new AuthException for the given code.
     *
     * @param errorCode the failure code
     */
    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, null, null);
    }

    /**
     * Constructs a new AuthException for the given code and cause.
     *
     * @param errorCode the failure code
     * @param cause the underlying failure
     */
    public AuthException(AuthErrorCode errorCode, Throwable cause) {
        this(errorCode, null, cause);
    }

    private AuthException(AuthErrorCode errorCode, Duration retryAfter, Throwable cause) {
        super(errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Constructs a RATE_LIMITED exception.
     *
     * @param retryAfter time until the current rate-limit window resets
     * @return an AuthException carrying the retry delay
     */
    public static AuthException rateLimited(Duration retryAfter) {
        return new AuthException(AuthErrorCode.RATE_LIMITED, retryAfter, null);
    }

    /**
     * Constructs a STORE_UNAVAILABLE exception for a failed cache call.
     *
     * @param cause the data access failure
     * @return an AuthException wrapping the cause
     */
    public static AuthException storeUnavailable(Throwable cause) {
        return new AuthException(AuthErrorCode.STORE_UNAVAILABLE, cause);
    }

    /**
     * Constructs an IDENTITY_STORE_UNAVAILABLE exception.
     *
     * @param cause the data access failure
     * @return an AuthException wrapping the cause
     */
    public static AuthException identityStoreUnavailable(Throwable cause) {
        return new AuthException(AuthErrorCode.IDENTITY_STORE_UNAVAILABLE, cause);
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Gets the time until the caller may retry, for RATE_LIMITED only.
     *
     * @return the retry delay, or null if not applicable
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
