package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 样本级CASA指标（一次完成的分析对应一个实例）
 */
@Value
@Builder
@Jacksonized
public class CasaMetrics {

    /** 有效轨迹（或检测）总数 */
    int totalCount;

    /** 浓度估计（百万/ml，需按仪器标定） */
    double concentration;

    /** 前向运动 PR（%） */
    double progressiveMotility;

    /** 非前向运动 NP（%） */
    double nonProgressiveMotility;

    /** 总活力 PR+NP（%） */
    double totalMotility;

    /** 不动 IM（%） */
    double immotile;

    ParameterSummary vcl;

    ParameterSummary vsl;

    ParameterSummary vap;

    ParameterSummary lin;

    ParameterSummary str;

    ParameterSummary wob;

    ParameterSummary alh;

    ParameterSummary bcf;

    public ParameterSummary summaryOf(KinematicParameter parameter) {
        switch (parameter) {
            case VCL:
                return vcl;
            case VSL:
                return vsl;
            case VAP:
                return vap;
            case LIN:
                return lin;
            case STR:
                return str;
            case WOB:
                return wob;
            case ALH:
                return alh;
            case BCF:
                return bcf;
            default:
                throw new IllegalArgumentException("未知参数: " + parameter);
        }
    }
}
