package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 分析任务状态：pending → processing → completed | failed
 */
public enum AnalysisStatus {

    @JsonProperty("pending")
    PENDING,

    @JsonProperty("processing")
    PROCESSING,

    @JsonProperty("completed")
    COMPLETED,

    @JsonProperty("failed")
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String label() {
        return name().toLowerCase();
    }

    public static AnalysisStatus fromLabel(String label) {
        return AnalysisStatus.valueOf(label.trim().toUpperCase());
    }
}
