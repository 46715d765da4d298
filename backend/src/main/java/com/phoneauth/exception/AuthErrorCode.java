package com.phoneauth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable failure codes of the authentication core.
 *
 * {@code expected} marks business outcomes (wrong code, expired token, rate
 * limit) that are reported to the caller verbatim and are not system failures.
 * The remaining codes are infrastructure failures of the current request.
 */
@Getter
public enum AuthErrorCode {
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, true,
            "Too many verification codes requested. Please try again later."),
    NOT_FOUND(HttpStatus.BAD_REQUEST, true,
            "No pending verification code. Please request a new code."),
    EXPIRED(HttpStatus.UNAUTHORIZED, true,
            "The code or token has expired."),
    CODE_MISMATCH(HttpStatus.UNAUTHORIZED, true,
            "The verification code is not correct."),
    TOO_MANY_ATTEMPTS(HttpStatus.UNAUTHORIZED, true,
            "Too many incorrect attempts. Please request a new code."),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, true,
            "The token signature is not valid."),
    WRONG_TYPE(HttpStatus.UNAUTHORIZED, true,
            "The token cannot be used for this operation."),
    REVOKED(HttpStatus.UNAUTHORIZED, true,
            "The token has been revoked."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, true,
            "The token is not valid."),
    INVALID_PHONE(HttpStatus.BAD_REQUEST, true,
            "The phone number is not valid."),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, false,
            "Authentication is temporarily unavailable. Please try again later."),
    IDENTITY_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, false,
            "Authentication is temporarily unavailable. Please try again later."),
    DISPATCH_FAILED(HttpStatus.BAD_GATEWAY, false,
            "The verification code could not be delivered.");

    private final HttpStatus status;
    private final boolean expected;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus status, boolean expected, String defaultMessage) {
        this.status = status;
        this.expected = expected;
        this.defaultMessage = defaultMessage;
    }

    /**
     * Code as rendered in error responses, e.g. {@code CODE_MISMATCH}.
     *
     * @return the machine-readable code
     */
    public String getCode() {
        return name();
    }
}
