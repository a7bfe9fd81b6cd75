package com.example.casa.exception;

import com.example.casa.dto.AnalysisStatus;

/**
 * 结果尚不可用（任务仍在处理或已失败）
 */
public class AnalysisNotReadyException extends CasaAnalysisException {

    private final AnalysisStatus status;

    public AnalysisNotReadyException(String analysisId, AnalysisStatus status) {
        super(ErrorCategory.INTERNAL, "Analysis " + analysisId + " has no result yet (status: " + status.label() + ")");
        this.status = status;
    }

    public AnalysisStatus getStatus() {
        return status;
    }
}
