package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 流水线计算结果，交给编排器完成任务
 */
@Value
@Builder
public class AnalysisOutcome {

    CasaMetrics casaMetrics;

    List<SpermTrack> tracks;

    VideoMetrics videoMetrics;

    ImageMetrics imageMetrics;

    QualityAssessment assessment;

    long fileSize;

    String modelVersion;
}
