package com.example.casa.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 检测/跟踪服务返回的视频结果
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VideoTrackingData {

    /** 逐帧检测统计 */
    private List<FrameSummary> frames;

    /** 轨迹ID -> 按时间排序的检测点 */
    private Map<Integer, List<SpermDetection>> tracks;

    /** 模型版本 */
    private String modelVersion;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FrameSummary {
        private int frameNumber;
        private double timestamp;
        private int detectionCount;
    }
}
