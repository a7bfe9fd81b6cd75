package com.example.casa.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.Map;

/**
 * 分析提交请求
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AnalysisRequest {

    /** 样本文件路径 */
    @NotBlank(message = "文件路径不能为空")
    private String filePath;

    /** 原始文件名 */
    private String filename;

    /** 分析类型 */
    @NotNull(message = "分析类型不能为空")
    private AnalysisType analysisType;

    /** 附加参数 */
    private Map<String, Object> parameters;
}
