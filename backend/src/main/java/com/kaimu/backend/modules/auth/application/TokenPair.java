package com.kaimu.backend.modules.auth.application;

/**
 * Credentials handed to the client. The refresh token is the only plaintext copy that ever exists.
 */
public record TokenPair(String accessToken, String refreshToken, long expiresInSeconds) {
}
