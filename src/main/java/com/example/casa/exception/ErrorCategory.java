package com.example.casa.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 错误分类
 */
public enum ErrorCategory {

    /** 轨迹数据异常，丢弃该轨迹 */
    @JsonProperty("input")
    INPUT,

    /** 检测/跟踪服务或媒体读取失败，任务失败 */
    @JsonProperty("upstream")
    UPSTREAM,

    /** 结果写入持久化存储失败 */
    @JsonProperty("persistence")
    PERSISTENCE,

    @JsonProperty("not_found")
    NOT_FOUND,

    @JsonProperty("internal")
    INTERNAL
}
