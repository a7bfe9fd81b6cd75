package com.example.casa.exception;

/**
 * 检测/跟踪服务调用失败或样本媒体无法读取
 */
public class UpstreamException extends CasaAnalysisException {

    public UpstreamException(String message) {
        super(ErrorCategory.UPSTREAM, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(ErrorCategory.UPSTREAM, message, cause);
    }
}
