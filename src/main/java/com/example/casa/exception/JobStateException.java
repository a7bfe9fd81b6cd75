package com.example.casa.exception;

/**
 * 对已进入终态或不存在的任务进行写操作
 */
public class JobStateException extends CasaAnalysisException {

    public JobStateException(String message) {
        super(ErrorCategory.INTERNAL, message);
    }
}
