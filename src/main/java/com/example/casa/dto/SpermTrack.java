package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 精子轨迹：同一目标在连续帧中的检测序列（插入顺序即时间顺序）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SpermTrack {

    int trackId;

    List<SpermDetection> detections;

    int startFrame;

    int endFrame;

    /** 持续时间（秒） */
    double duration;

    /** 运动学参数，无法计算时为null */
    TrackKinematics kinematics;

    /** 轨迹被排除在群体统计之外的原因 */
    String rejectionReason;

    @JsonIgnore
    public boolean hasKinematics() {
        return kinematics != null;
    }

    @JsonIgnore
    public int getPointCount() {
        return detections != null ? detections.size() : 0;
    }

    public static class SpermTrackBuilder {

        public SpermTrackBuilder detections(List<SpermDetection> detections) {
            this.detections = detections != null ? List.copyOf(detections) : null;
            return this;
        }
    }
}
