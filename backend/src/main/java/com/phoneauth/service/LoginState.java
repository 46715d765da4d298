package com.phoneauth.service;

/**
 * Progress of a single login attempt.
 *
 * AWAITING_CODE → VERIFIED → TOKEN_ISSUED, and any state may end in FAILED.
 * A login attempt is not stored; the state is reported to clients and logged.
 */
public enum LoginState {
    AWAITING_CODE,
    VERIFIED,
    TOKEN_ISSUED,
    FAILED
}
