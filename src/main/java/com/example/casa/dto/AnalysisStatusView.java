package com.example.casa.dto;

import com.example.casa.exception.ErrorCategory;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 任务状态视图
 */
@Value
@Builder
public class AnalysisStatusView {

    String analysisId;

    AnalysisStatus status;

    double progress;

    String message;

    LocalDateTime createdAt;

    LocalDateTime completedAt;

    String errorMessage;

    ErrorCategory errorCategory;

    boolean persistenceFailed;

    public static AnalysisStatusView of(AnalysisJob job) {
        return AnalysisStatusView.builder()
                .analysisId(job.getAnalysisId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .message(job.getMessage())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .errorMessage(job.getErrorMessage())
                .errorCategory(job.getErrorCategory())
                .persistenceFailed(job.isPersistenceFailed())
                .build();
    }
}
