package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 参考标准下的样本质量评估
 */
@Value
@Builder
@Jacksonized
public class QualityAssessment {

    ReferenceStatus concentrationStatus;

    ReferenceStatus progressiveMotilityStatus;

    ReferenceStatus totalMotilityStatus;

    QualitySeverity overallQuality;

    List<String> recommendations;

    public static class QualityAssessmentBuilder {

        public QualityAssessmentBuilder recommendations(List<String> recommendations) {
            this.recommendations = recommendations != null ? List.copyOf(recommendations) : null;
            return this;
        }
    }
}
