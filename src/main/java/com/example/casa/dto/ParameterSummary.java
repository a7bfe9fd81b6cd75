package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个运动学参数在群体中的均值与标准差
 */
@Value
@Builder
@Jacksonized
public class ParameterSummary {

    public static final ParameterSummary EMPTY = ParameterSummary.builder().build();

    double mean;

    /** 总体标准差 */
    double std;

    /** 参与统计的轨迹数 */
    int sampleCount;
}
