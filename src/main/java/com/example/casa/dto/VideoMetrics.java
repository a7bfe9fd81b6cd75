package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 视频样本特有指标
 */
@Value
@Builder
@Jacksonized
public class VideoMetrics {

    long totalFrames;

    double fps;

    /** 视频时长（秒） */
    double duration;

    int width;

    int height;

    /** 每帧检测数 */
    List<Integer> frameCounts;

    /** 每帧密度（个/百万像素） */
    List<Double> frameDensities;

    /** 检测数随时间变化 */
    List<CountPoint> countOverTime;

    @Value
    @Builder
    @Jacksonized
    public static class CountPoint {
        double time;
        int count;
    }

    public static class VideoMetricsBuilder {

        public VideoMetricsBuilder frameCounts(List<Integer> frameCounts) {
            this.frameCounts = frameCounts != null ? List.copyOf(frameCounts) : null;
            return this;
        }

        public VideoMetricsBuilder frameDensities(List<Double> frameDensities) {
            this.frameDensities = frameDensities != null ? List.copyOf(frameDensities) : null;
            return this;
        }

        public VideoMetricsBuilder countOverTime(List<CountPoint> countOverTime) {
            this.countOverTime = countOverTime != null ? List.copyOf(countOverTime) : null;
            return this;
        }
    }
}
