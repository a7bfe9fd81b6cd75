package com.example.casa.service;

import com.example.casa.dto.CasaMetrics;
import com.example.casa.dto.QualityAssessment;
import com.example.casa.dto.QualitySeverity;
import com.example.casa.dto.ReferenceStatus;
import com.example.casa.dto.ReferenceThresholds;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 按参考标准评估样本质量
 */
@Service
public class QualityAssessmentEngine {

    static final String ALL_NORMAL = "All parameters within normal range";

    public QualityAssessment assess(CasaMetrics metrics, ReferenceThresholds thresholds) {
        ReferenceStatus concentration = statusOf(metrics.getConcentration(), thresholds.getConcentrationLowerLimit());
        ReferenceStatus progressive = statusOf(metrics.getProgressiveMotility(), thresholds.getProgressiveMotilityLowerLimit());
        ReferenceStatus total = statusOf(metrics.getTotalMotility(), thresholds.getTotalMotilityLowerLimit());

        List<String> recommendations = new ArrayList<>();
        int issues = 0;
        if (concentration == ReferenceStatus.BELOW_REFERENCE) {
            issues++;
            recommendations.add("Low sperm concentration detected");
        }
        if (progressive == ReferenceStatus.BELOW_REFERENCE) {
            issues++;
            recommendations.add("Low progressive motility detected");
        }
        if (total == ReferenceStatus.BELOW_REFERENCE) {
            issues++;
            recommendations.add("Low total motility detected");
        }
        if (recommendations.isEmpty()) {
            recommendations.add(ALL_NORMAL);
        }

        return QualityAssessment.builder()
                .concentrationStatus(concentration)
                .progressiveMotilityStatus(progressive)
                .totalMotilityStatus(total)
                .overallQuality(QualitySeverity.ofIssueCount(issues))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    private static ReferenceStatus statusOf(double value, double lowerLimit) {
        return value >= lowerLimit ? ReferenceStatus.NORMAL : ReferenceStatus.BELOW_REFERENCE;
    }
}
