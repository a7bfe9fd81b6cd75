package com.example.casa.exception;

/**
 * 分析相关异常的基类
 */
public class CasaAnalysisException extends RuntimeException {

    private final ErrorCategory category;

    public CasaAnalysisException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public CasaAnalysisException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * 取异常链中最具体的分类，无法识别的异常归为INTERNAL
     */
    public static ErrorCategory categoryOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CasaAnalysisException) {
                return ((CasaAnalysisException) current).getCategory();
            }
            current = current.getCause();
        }
        return ErrorCategory.INTERNAL;
    }
}
