package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AnalysisType {

    @JsonProperty("video")
    VIDEO,

    @JsonProperty("image")
    IMAGE;

    public static AnalysisType parse(String value) {
        if (value == null) {
            return VIDEO;
        }
        try {
            return AnalysisType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("不支持的分析类型: " + value);
        }
    }
}
