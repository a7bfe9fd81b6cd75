package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 静态图像样本特有指标
 */
@Value
@Builder
@Jacksonized
public class ImageMetrics {

    int width;

    int height;

    /** 高密度区域 */
    List<DensityRegion> detectionRegions;

    @Value
    @Builder
    @Jacksonized
    public static class DensityRegion {
        double minX;
        double maxX;
        double minY;
        double maxY;
        double density;
    }

    public static class ImageMetricsBuilder {

        public ImageMetricsBuilder detectionRegions(List<DensityRegion> detectionRegions) {
            this.detectionRegions = detectionRegions != null ? List.copyOf(detectionRegions) : null;
            return this;
        }
    }
}
