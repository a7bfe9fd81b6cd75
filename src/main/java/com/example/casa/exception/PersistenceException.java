package com.example.casa.exception;

public class PersistenceException extends CasaAnalysisException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCategory.PERSISTENCE, message, cause);
    }
}
