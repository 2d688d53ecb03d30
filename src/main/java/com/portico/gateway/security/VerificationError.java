package com.portico.gateway.security;

/**
 * Tipos de fallo en la verificación de un token.
 * Se registran en los logs, nunca se exponen al cliente.
 */
public enum VerificationError {
    MALFORMED_TOKEN,
    UNSUPPORTED_ALGORITHM,
    INVALID_SIGNATURE,
    TOKEN_EXPIRED,
    TOKEN_NOT_YET_VALID,
    MISSING_SUBJECT
}
