package com.example.casa.config;

import com.example.casa.dto.ReferenceThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

/**
 * CASA分析参数。标定系数与阈值均为占位值，实际部署需按显微镜与计数池标定
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "casa")
public class CasaProperties {

    @Valid
    private Calibration calibration = new Calibration();

    @Valid
    private Kinematics kinematics = new Kinematics();

    @Valid
    private Motility motility = new Motility();

    @Valid
    private Reference reference = new Reference();

    @Valid
    private Tracking tracking = new Tracking();

    @Valid
    private Cache cache = new Cache();

    public ReferenceThresholds referenceThresholds() {
        return ReferenceThresholds.builder()
                .concentrationLowerLimit(reference.getConcentrationLowerLimit())
                .progressiveMotilityLowerLimit(reference.getProgressiveMotilityLowerLimit())
                .totalMotilityLowerLimit(reference.getTotalMotilityLowerLimit())
                .build();
    }

    @Data
    public static class Calibration {
        /** 每像素对应微米数 */
        @DecimalMin(value = "0.0", inclusive = false)
        private double micronsPerPixel = 0.2;

        /** 每条有效轨迹对应的浓度（百万/ml） */
        @DecimalMin("0.0")
        private double concentrationPerTrack = 1.0;
    }

    @Data
    public static class Kinematics {
        /** 有效轨迹最少点数 */
        @Min(3)
        private int minTrackLength = 3;

        /** VAP平滑窗口 */
        @Min(1)
        private int smoothingWindow = 3;

        /** 点数达到该值才做平滑，否则VAP取VSL */
        @Min(3)
        private int minPointsForSmoothing = 5;

        /** 点数达到该值才计算BCF */
        @Min(3)
        private int minPointsForBcf = 5;
    }

    @Data
    public static class Motility {
        /** 前向运动VCL阈值（μm/s） */
        private double vclProgressive = 25.0;

        /** 前向运动VSL阈值（μm/s） */
        private double vslProgressive = 5.0;

        /** 非前向运动的最小VCL（μm/s） */
        private double vclMinimal = 5.0;
    }

    @Data
    public static class Reference {
        private double concentrationLowerLimit = 15.0;
        private double progressiveMotilityLowerLimit = 32.0;
        private double totalMotilityLowerLimit = 40.0;
    }

    @Data
    public static class Tracking {
        /** 检测/跟踪服务地址 */
        @NotBlank
        private String baseUrl = "http://localhost:8000";

        /** 调用超时（秒） */
        @Min(1)
        private int timeoutSeconds = 600;

        private String modelVersion = "yolov8n";
    }

    @Data
    public static class Cache {
        @Min(1)
        private long maximumSize = 200;

        /** 访问后过期时间（分钟） */
        @Min(1)
        private long expireAfterAccessMinutes = 60;
    }
}
