package com.portico.gateway.support;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Tokens firmados para pruebas.
 */
public final class TestTokens {

    public static final String SECRET = "0123456789abcdef".repeat(4);
    public static final String OTHER_SECRET = "fedcba9876543210".repeat(4);

    private TestTokens() {
    }

    public static SecretKey key() {
        return key(SECRET);
    }

    public static SecretKey key(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public static JwtBuilder builder(String subject) {
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(Duration.ofMinutes(15))));
    }

    public static String hs256(String subject, List<String> roles) {
        return builder(subject)
                .claim("roles", roles)
                .signWith(key(), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String hs256(String subject) {
        return builder(subject)
                .signWith(key(), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String hs512(String subject) {
        return builder(subject)
                .signWith(key(), SignatureAlgorithm.HS512)
                .compact();
    }

    public static String signedWith(String secret, String subject) {
        return builder(subject)
                .signWith(key(secret), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String expired(String subject) {
        Instant past = Instant.now().minus(Duration.ofHours(1));
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(past.minus(Duration.ofMinutes(5))))
                .setExpiration(Date.from(past))
                .signWith(key(), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String notYetValid(String subject) {
        Instant future = Instant.now().plus(Duration.ofHours(1));
        return builder(subject)
                .setNotBefore(Date.from(future))
                .setExpiration(Date.from(future.plus(Duration.ofHours(1))))
                .signWith(key(), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String withoutSubject() {
        return Jwts.builder()
                .claim("roles", List.of("admin"))
                .setExpiration(Date.from(Instant.now().plus(Duration.ofMinutes(15))))
                .signWith(key(), SignatureAlgorithm.HS256)
                .compact();
    }

    public static String rs256(String subject) {
        KeyPair keyPair = Keys.keyPairFor(SignatureAlgorithm.RS256);
        return builder(subject)
                .signWith(keyPair.getPrivate(), SignatureAlgorithm.RS256)
                .compact();
    }

    /**
     * Token sin firma ("alg":"none").
     */
    public static String unsigned(String subject) {
        return builder(subject).compact();
    }
}
