package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个检测点（由检测/跟踪服务产生，创建后不可变）
 */
@Value
@Builder
@Jacksonized
public class SpermDetection {

    /** 中心点X坐标（像素） */
    double x;

    /** 中心点Y坐标（像素） */
    double y;

    /** 检测置信度 */
    double confidence;

    /** 帧号 */
    int frameNumber;

    /** 时间戳（秒） */
    double timestamp;
}
