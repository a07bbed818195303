package com.medassist.exception;

/**
 * Raised only when the term dictionary is empty, which is a configuration error.
 */
public class NoCanonicalFormException extends RuntimeException {

    public NoCanonicalFormException(String message) {
        super(message);
    }
}
