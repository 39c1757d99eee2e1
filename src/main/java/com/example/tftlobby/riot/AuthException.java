package com.example.tftlobby.riot;

/**
 * The API key was rejected. Nothing else in the run can succeed once this happens.
 */
public class AuthException extends RuntimeException {

    private final int status;

    public AuthException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
