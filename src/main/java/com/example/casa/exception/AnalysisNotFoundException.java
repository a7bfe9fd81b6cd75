package com.example.casa.exception;

public class AnalysisNotFoundException extends CasaAnalysisException {

    public AnalysisNotFoundException(String analysisId) {
        super(ErrorCategory.NOT_FOUND, "Analysis not found: " + analysisId);
    }
}
