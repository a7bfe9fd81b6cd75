package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * 单条轨迹导出行，被排除的轨迹运动学列为空
 */
@Value
@Builder
@JsonPropertyOrder({"track_id", "start_frame", "end_frame", "duration", "vcl", "vsl", "vap",
        "lin", "str", "wob", "alh", "bcf", "motility_class", "rejection_reason"})
public class TrackRow {

    @JsonProperty("track_id")
    int trackId;

    @JsonProperty("start_frame")
    int startFrame;

    @JsonProperty("end_frame")
    int endFrame;

    @JsonProperty("duration")
    double duration;

    @JsonProperty("vcl")
    Double vcl;

    @JsonProperty("vsl")
    Double vsl;

    @JsonProperty("vap")
    Double vap;

    @JsonProperty("lin")
    Double lin;

    @JsonProperty("str")
    Double str;

    @JsonProperty("wob")
    Double wob;

    @JsonProperty("alh")
    Double alh;

    @JsonProperty("bcf")
    Double bcf;

    @JsonProperty("motility_class")
    String motilityClass;

    @JsonProperty("rejection_reason")
    String rejectionReason;
}
