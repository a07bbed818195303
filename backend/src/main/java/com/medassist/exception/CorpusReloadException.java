package com.medassist.exception;

public class CorpusReloadException extends RuntimeException {

    public CorpusReloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
