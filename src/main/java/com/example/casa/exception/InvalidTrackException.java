package com.example.casa.exception;

/**
 * 轨迹点不足、时间戳不递增或几何退化
 */
public class InvalidTrackException extends CasaAnalysisException {

    public InvalidTrackException(String message) {
        super(ErrorCategory.INPUT, message);
    }
}
