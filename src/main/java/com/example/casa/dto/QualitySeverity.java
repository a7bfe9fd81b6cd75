package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 样本整体质量等级，按低于参考值的维度数划分
 */
public enum QualitySeverity {

    @JsonProperty("normal")
    NORMAL,

    @JsonProperty("mild")
    MILD,

    @JsonProperty("moderate")
    MODERATE,

    @JsonProperty("severe")
    SEVERE;

    public static QualitySeverity ofIssueCount(int issues) {
        if (issues <= 0) {
            return NORMAL;
        }
        if (issues == 1) {
            return MILD;
        }
        if (issues == 2) {
            return MODERATE;
        }
        return SEVERE;
    }
}
