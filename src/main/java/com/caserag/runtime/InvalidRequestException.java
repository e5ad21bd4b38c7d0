package com.caserag.runtime;

/**
 * Caller-fixable input problem, reported before any provider or store call is made.
 */
public class InvalidRequestException extends IllegalArgumentException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
