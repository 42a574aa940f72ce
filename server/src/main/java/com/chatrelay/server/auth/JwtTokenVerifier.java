package com.chatrelay.server.auth;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC-signed JWT issued by the REST service. The user id travels in the {@code id}
 * claim, the display name in {@code username}.
 */
@Component
public class JwtTokenVerifier implements TokenVerifier {

    private final SecretKey key;

    public JwtTokenVerifier(@Value("${auth.jwt.secret}") String secret) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new RealtimeException(ErrorCode.AUTH_FAILED, "Token is required");
        }
        Claims claims;
        try {
            claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new RealtimeException(ErrorCode.AUTH_FAILED, "Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            throw new RealtimeException(ErrorCode.AUTH_FAILED, "Invalid token");
        }
        String userId = claims.get("id", String.class);
        if (userId == null || userId.isEmpty()) {
            throw new RealtimeException(ErrorCode.AUTH_FAILED, "Token carries no user id");
        }
        return new VerifiedToken(userId, claims.get("username", String.class));
    }
}
