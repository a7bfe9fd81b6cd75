package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 参考标准下限
 */
@Value
@Builder
public class ReferenceThresholds {

    /** 浓度下限（百万/ml） */
    double concentrationLowerLimit;

    /** 前向运动下限（%） */
    double progressiveMotilityLowerLimit;

    /** 总活力下限（%） */
    double totalMotilityLowerLimit;
}
