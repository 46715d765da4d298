package com.phoneauth.service;

import com.phoneauth.security.TokenPair;

import java.util.UUID;

/**
 * Outcome of a completed login: the resolved user and a fresh token pair.
 */
public record LoginResult(UUID userId, TokenPair tokens) {
}
