package com.example.casa.service;

import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.CasaMetrics;
import com.example.casa.dto.CasaSummaryRow;
import com.example.casa.dto.ParameterSummary;
import com.example.casa.dto.SpermTrack;
import com.example.casa.dto.TrackKinematics;
import com.example.casa.dto.TrackRow;
import com.example.casa.exception.CasaAnalysisException;
import com.example.casa.exception.ErrorCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 已完成分析的CSV/JSON导出
 */
@Slf4j
@Service
public class CasaExportService {

    private final AnalysisJobOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public CasaExportService(AnalysisJobOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    public Mono<String> exportSummaryCsv(String analysisId) {
        return orchestrator.getResult(analysisId).map(this::summaryCsv);
    }

    public Mono<String> exportTracksCsv(String analysisId) {
        return orchestrator.getResult(analysisId).map(this::tracksCsv);
    }

    public Mono<String> exportJson(String analysisId) {
        return orchestrator.getResult(analysisId).map(this::json);
    }

    String summaryCsv(AnalysisJob job) {
        return writeCsv(CasaSummaryRow.class, List.of(summaryRow(job)));
    }

    /**
     * 每条轨迹一行（含被排除的轨迹）
     */
    String tracksCsv(AnalysisJob job) {
        List<SpermTrack> tracks = job.getTracks() != null ? job.getTracks() : List.of();
        List<TrackRow> rows = tracks.stream()
                .map(CasaExportService::trackRow)
                .collect(Collectors.toList());
        return writeCsv(TrackRow.class, rows);
    }

    String json(AnalysisJob job) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new CasaAnalysisException(ErrorCategory.INTERNAL, "Failed to export analysis " + job.getAnalysisId(), e);
        }
    }

    static CasaSummaryRow summaryRow(AnalysisJob job) {
        CasaMetrics metrics = job.getCasaMetrics();
        return CasaSummaryRow.builder()
                .analysisId(job.getAnalysisId())
                .filename(job.getFilename())
                .analysisType(job.getAnalysisType() != null ? job.getAnalysisType().name().toLowerCase() : null)
                .createdAt(job.getCreatedAt() != null ? job.getCreatedAt().toString() : null)
                .processingTime(job.getProcessingTime())
                .totalCount(metrics.getTotalCount())
                .concentration(metrics.getConcentration())
                .progressiveMotility(metrics.getProgressiveMotility())
                .nonProgressiveMotility(metrics.getNonProgressiveMotility())
                .totalMotility(metrics.getTotalMotility())
                .immotile(metrics.getImmotile())
                .vclMean(mean(metrics.getVcl()))
                .vclStd(std(metrics.getVcl()))
                .vslMean(mean(metrics.getVsl()))
                .vslStd(std(metrics.getVsl()))
                .vapMean(mean(metrics.getVap()))
                .vapStd(std(metrics.getVap()))
                .linMean(mean(metrics.getLin()))
                .strMean(mean(metrics.getStr()))
                .wobMean(mean(metrics.getWob()))
                .alhMean(mean(metrics.getAlh()))
                .bcfMean(mean(metrics.getBcf()))
                .build();
    }

    static TrackRow trackRow(SpermTrack track) {
        TrackRow.TrackRowBuilder row = TrackRow.builder()
                .trackId(track.getTrackId())
                .startFrame(track.getStartFrame())
                .endFrame(track.getEndFrame())
                .duration(track.getDuration())
                .rejectionReason(track.getRejectionReason());
        TrackKinematics kinematics = track.getKinematics();
        if (kinematics != null) {
            row.vcl(kinematics.getVcl())
                    .vsl(kinematics.getVsl())
                    .vap(kinematics.getVap())
                    .lin(kinematics.getLin())
                    .str(kinematics.getStr())
                    .wob(kinematics.getWob())
                    .alh(kinematics.getAlh())
                    .bcf(kinematics.getBcf())
                    .motilityClass(kinematics.getMotilityClass().getLabel());
        }
        return row.build();
    }

    private <T> String writeCsv(Class<T> rowType, List<T> rows) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new CasaAnalysisException(ErrorCategory.INTERNAL, "Failed to write CSV", e);
        }
    }

    private static double mean(ParameterSummary summary) {
        return summary != null ? summary.getMean() : 0.0;
    }

    private static double std(ParameterSummary summary) {
        return summary != null ? summary.getStd() : 0.0;
    }
}
