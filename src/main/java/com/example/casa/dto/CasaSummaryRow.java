package com.example.casa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * 样本汇总导出行
 */
@Value
@Builder
@JsonPropertyOrder({"analysis_id", "filename", "analysis_type", "created_at", "processing_time",
        "total_count", "concentration", "progressive_motility_pct", "non_progressive_motility_pct",
        "total_motility_pct", "immotile_pct", "vcl_mean", "vcl_std", "vsl_mean", "vsl_std",
        "vap_mean", "vap_std", "lin_mean", "str_mean", "wob_mean", "alh_mean", "bcf_mean"})
public class CasaSummaryRow {

    @JsonProperty("analysis_id")
    String analysisId;

    @JsonProperty("filename")
    String filename;

    @JsonProperty("analysis_type")
    String analysisType;

    @JsonProperty("created_at")
    String createdAt;

    @JsonProperty("processing_time")
    Double processingTime;

    @JsonProperty("total_count")
    int totalCount;

    @JsonProperty("concentration")
    double concentration;

    @JsonProperty("progressive_motility_pct")
    double progressiveMotility;

    @JsonProperty("non_progressive_motility_pct")
    double nonProgressiveMotility;

    @JsonProperty("total_motility_pct")
    double totalMotility;

    @JsonProperty("immotile_pct")
    double immotile;

    @JsonProperty("vcl_mean")
    double vclMean;

    @JsonProperty("vcl_std")
    double vclStd;

    @JsonProperty("vsl_mean")
    double vslMean;

    @JsonProperty("vsl_std")
    double vslStd;

    @JsonProperty("vap_mean")
    double vapMean;

    @JsonProperty("vap_std")
    double vapStd;

    @JsonProperty("lin_mean")
    double linMean;

    @JsonProperty("str_mean")
    double strMean;

    @JsonProperty("wob_mean")
    double wobMean;

    @JsonProperty("alh_mean")
    double alhMean;

    @JsonProperty("bcf_mean")
    double bcfMean;
}
