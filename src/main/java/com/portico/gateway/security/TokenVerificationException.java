package com.portico.gateway.security;

/**
 * Excepción específica para errores de verificación de tokens JWT.
 */
public class TokenVerificationException extends RuntimeException {

    private final VerificationError error;

    public TokenVerificationException(VerificationError error, String message) {
        super(message);
        this.error = error;
    }

    public TokenVerificationException(VerificationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public VerificationError getError() {
        return error;
    }
}
