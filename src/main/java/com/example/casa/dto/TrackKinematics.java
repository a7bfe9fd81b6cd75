package com.example.casa.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单条轨迹的CASA运动学参数，八个参数要么全部存在，要么整体缺失
 */
@Value
@Builder
@Jacksonized
public class TrackKinematics {

    /** 曲线速度 VCL（μm/s） */
    double vcl;

    /** 直线速度 VSL（μm/s） */
    double vsl;

    /** 平均路径速度 VAP（μm/s） */
    double vap;

    /** 直线性 LIN（%） */
    double lin;

    /** 前向性 STR（%） */
    double str;

    /** 摆动性 WOB（%） */
    double wob;

    /** 头部侧摆幅度 ALH（μm） */
    double alh;

    /** 鞭打频率 BCF（Hz） */
    double bcf;

    /** 活力分级 */
    MotilityClass motilityClass;
}
