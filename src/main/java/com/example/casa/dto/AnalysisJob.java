package com.example.casa.dto;

import com.example.casa.exception.ErrorCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分析任务的不可变快照，持久化时整体序列化为一个JSON文档。
 * 状态变化只能通过编排器以toBuilder生成新快照
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisJob {

    /** 任务ID */
    String analysisId;

    /** 输入文件路径 */
    String filePath;

    /** 原始文件名 */
    String filename;

    /** 文件大小（字节） */
    long fileSize;

    /** 分析类型 */
    AnalysisType analysisType;

    /** 当前状态 */
    AnalysisStatus status;

    /** 进度 0-100 */
    double progress;

    /** 状态消息 */
    String message;

    /** 创建时间 */
    LocalDateTime createdAt;

    /** 完成时间 */
    LocalDateTime completedAt;

    /** 总处理时间（秒） */
    Double processingTime;

    /** 轨迹（含被排除的轨迹） */
    List<SpermTrack> tracks;

    /** 样本级CASA指标 */
    CasaMetrics casaMetrics;

    /** 视频指标 */
    VideoMetrics videoMetrics;

    /** 图像指标 */
    ImageMetrics imageMetrics;

    /** 质量评估 */
    QualityAssessment assessment;

    /** 检测模型版本 */
    String modelVersion;

    /** 使用的分析参数 */
    Map<String, Object> parametersUsed;

    /** 错误信息 */
    String errorMessage;

    /** 错误类别 */
    ErrorCategory errorCategory;

    /** 结果已计算但持久化失败 */
    boolean persistenceFailed;

    public static class AnalysisJobBuilder {

        public AnalysisJobBuilder tracks(List<SpermTrack> tracks) {
            this.tracks = tracks != null ? List.copyOf(tracks) : null;
            return this;
        }

        public AnalysisJobBuilder parametersUsed(Map<String, Object> parametersUsed) {
            this.parametersUsed = parametersUsed != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(parametersUsed))
                    : null;
            return this;
        }
    }
}
