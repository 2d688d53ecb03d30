package com.portico.gateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.SigningKeyResolverAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.Key;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Verificador de tokens JWT firmados con HMAC.
 *
 * Sólo acepta la familia HS256/HS384/HS512. El algoritmo declarado en la cabecera
 * se comprueba antes de elegir la clave, de modo que un token firmado con otra
 * familia (incluida RSA/EC o "none") se rechaza siempre.
 */
public class TokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(TokenVerifier.class);

    private static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
            SignatureAlgorithm.HS256.getValue(),
            SignatureAlgorithm.HS384.getValue(),
            SignatureAlgorithm.HS512.getValue());

    private final byte[] secret;
    private final JwtParser jwtParser;
    private final ObjectMapper objectMapper;

    /**
     * @param secret Clave compartida con el emisor de los tokens
     * @param clockSkew Tolerancia para las validaciones de exp/nbf
     * @param objectMapper Mapper para leer la cabecera del token
     */
    public TokenVerifier(byte[] secret, Duration clockSkew, ObjectMapper objectMapper) {
        this.secret = secret.clone();
        this.objectMapper = objectMapper;
        this.jwtParser = Jwts.parserBuilder()
                .setSigningKeyResolver(new HmacKeyResolver())
                .setAllowedClockSkewSeconds(clockSkew.getSeconds())
                .build();

        logger.info("Verificador JWT inicializado: algoritmos {}, clock skew {}s",
                SUPPORTED_ALGORITHMS, clockSkew.getSeconds());
    }

    /**
     * Verifica un token y devuelve sus claims.
     *
     * @param token Token JWT sin el prefijo "Bearer"
     * @return Claims verificados
     * @throws TokenVerificationException si el token no es válido
     */
    public ClaimSet verify(String token) {
        if (token == null || token.isEmpty()) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN, "Token vacío");
        }

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "El token no tiene la forma header.payload.signature");
        }

        String algorithm = readAlgorithm(parts[0]);
        if (!SUPPORTED_ALGORITHMS.contains(algorithm)) {
            throw new TokenVerificationException(VerificationError.UNSUPPORTED_ALGORITHM,
                    "Algoritmo no soportado: " + algorithm);
        }
        if (parts[2].isEmpty()) {
            throw new TokenVerificationException(VerificationError.INVALID_SIGNATURE, "Token sin firma");
        }

        Claims claims = parseClaims(token);
        return toClaimSet(claims);
    }

    private Claims parseClaims(String token) {
        try {
            return jwtParser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(VerificationError.TOKEN_EXPIRED,
                    "Token expirado: " + e.getMessage(), e);
        } catch (PrematureJwtException e) {
            throw new TokenVerificationException(VerificationError.TOKEN_NOT_YET_VALID,
                    "Token todavía no válido: " + e.getMessage(), e);
        } catch (UnsupportedJwtException e) {
            // El algoritmo ya se comprobó: aquí sólo llegan payloads que no son claims JSON
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Token no soportado: " + e.getMessage(), e);
        } catch (MalformedJwtException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Token mal formado: " + e.getMessage(), e);
        } catch (SecurityException e) {
            // SignatureException y WeakKeyException
            throw new TokenVerificationException(VerificationError.INVALID_SIGNATURE,
                    "Firma inválida: " + e.getMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Token inválido: " + e.getMessage(), e);
        }
    }

    private ClaimSet toClaimSet(Claims claims) {
        Object subject = claims.get(Claims.SUBJECT);
        if (subject == null || subject.toString().isBlank()) {
            throw new TokenVerificationException(VerificationError.MISSING_SUBJECT, "El token no contiene subject");
        }
        return new ClaimSet(subject.toString(), extractRoles(claims), claims);
    }

    private List<String> extractRoles(Claims claims) {
        Object roles = claims.get(ClaimSet.ROLES_CLAIM);
        if (!(roles instanceof List)) {
            if (roles != null) {
                logger.debug("Claim roles ignorado, no es un arreglo: {}", roles.getClass().getSimpleName());
            }
            return List.of();
        }
        return ((List<?>) roles).stream()
                .map(String::valueOf)
                .collect(Collectors.toList());
    }

    /**
     * Lee el algoritmo declarado en la cabecera sin verificar la firma.
     */
    private String readAlgorithm(String encodedHeader) {
        try {
            byte[] headerJson = Decoders.BASE64URL.decode(encodedHeader);
            Map<?, ?> header = objectMapper.readValue(headerJson, Map.class);
            Object alg = header != null ? header.get(JwsHeader.ALGORITHM) : null;
            return alg != null ? alg.toString() : "";
        } catch (IOException | JwtException | ClassCastException e) {
            throw new TokenVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Cabecera del token ilegible", e);
        }
    }

    /**
     * Resuelve la clave HMAC para el algoritmo declarado. Rechaza cualquier otra familia
     * aunque la comprobación previa ya lo haya hecho.
     */
    private class HmacKeyResolver extends SigningKeyResolverAdapter {

        @Override
        public Key resolveSigningKey(JwsHeader header, Claims claims) {
            return hmacKey(header);
        }

        // Payload que no es JSON: se verifica la firma igualmente y se rechaza después
        @Override
        public Key resolveSigningKey(JwsHeader header, String plaintext) {
            return hmacKey(header);
        }

        private Key hmacKey(JwsHeader header) {
            String alg = header.getAlgorithm();
            if (!SUPPORTED_ALGORITHMS.contains(alg)) {
                throw new UnsupportedJwtException("Algoritmo no permitido: " + alg);
            }
            return new SecretKeySpec(secret, SignatureAlgorithm.forName(alg).getJcaName());
        }
    }
}
