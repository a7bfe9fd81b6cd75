package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * 任务列表条目
 */
@Value
@Builder
@Jacksonized
public class AnalysisSummary {

    String analysisId;

    AnalysisStatus status;

    LocalDateTime createdAt;

    String filename;

    AnalysisType analysisType;

    public static AnalysisSummary of(AnalysisJob job) {
        return AnalysisSummary.builder()
                .analysisId(job.getAnalysisId())
                .status(job.getStatus())
                .createdAt(job.getCreatedAt())
                .filename(job.getFilename())
                .analysisType(job.getAnalysisType())
                .build();
    }
}
