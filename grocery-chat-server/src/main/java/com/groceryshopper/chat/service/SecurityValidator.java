package com.groceryshopper.chat.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Bearer token validation.
 *
 * Tokens are HMAC-signed JWTs issued by the auth service; the subject is the username.
 */
@Service
@Slf4j
public class SecurityValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Validate the Authorization header and return the username it carries
     *
     * @throws ChatAccessException 401 when the header is missing or the token is invalid or expired
     */
    public String authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            metricsService.incrementCounter("auth.failure");
            throw new ChatAccessException(HttpStatus.UNAUTHORIZED, "Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();

        try {
            String username = extractAllClaims(token).getSubject();
            if (username == null || username.isBlank()) {
                metricsService.incrementCounter("auth.failure");
                throw new ChatAccessException(HttpStatus.UNAUTHORIZED, "Invalid token");
            }
            metricsService.incrementCounter("auth.success");
            return username;

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            metricsService.incrementCounter("auth.failure");
            throw new ChatAccessException(HttpStatus.UNAUTHORIZED, "Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            metricsService.incrementCounter("auth.failure");
            throw new ChatAccessException(HttpStatus.UNAUTHORIZED, "Invalid token");
        }
    }

    /**
     * Generate a token (for testing/development)
     */
    public String generateToken(String username) {
        return Jwts.builder()
            .subject(username)
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
            .verifyWith(secretKey)
            .build()
            .parseSignedClaims(token)
            .getPayload();
    }
}
