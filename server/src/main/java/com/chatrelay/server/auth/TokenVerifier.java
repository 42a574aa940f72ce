package com.chatrelay.server.auth;

public interface TokenVerifier {

    /**
     * @throws com.chatrelay.server.error.RealtimeException {@code AUTH_FAILED} for a
     *         missing, malformed, expired or wrongly signed token
     */
    VerifiedToken verify(String token);
}
