package com.example.casa.controller;

import com.example.casa.service.CasaExportService;
import com.example.casa.util.ApiResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/casa/export")
@RequiredArgsConstructor
public class ExportController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final CasaExportService exportService;

    /**
     * 样本汇总CSV
     */
    @GetMapping("/{analysisId}/csv")
    public Mono<ResponseEntity<Object>> exportSummaryCsv(@PathVariable String analysisId) {
        return exportService.exportSummaryCsv(analysisId)
                .map(csv -> attachment(csv, TEXT_CSV, "casa_summary_" + analysisId + ".csv"))
                .onErrorResume(ex -> {
                    log.error("导出CSV失败: {} ({})", analysisId, ex.getMessage());
                    return Mono.just(ApiResponses.errorObject(ex));
                });
    }

    /**
     * 逐轨迹CSV
     */
    @GetMapping("/{analysisId}/tracks.csv")
    public Mono<ResponseEntity<Object>> exportTracksCsv(@PathVariable String analysisId) {
        return exportService.exportTracksCsv(analysisId)
                .map(csv -> attachment(csv, TEXT_CSV, "casa_tracks_" + analysisId + ".csv"))
                .onErrorResume(ex -> {
                    log.error("导出轨迹CSV失败: {} ({})", analysisId, ex.getMessage());
                    return Mono.just(ApiResponses.errorObject(ex));
                });
    }

    @GetMapping("/{analysisId}/json")
    public Mono<ResponseEntity<Object>> exportJson(@PathVariable String analysisId) {
        return exportService.exportJson(analysisId)
                .map(json -> attachment(json, MediaType.APPLICATION_JSON, "casa_analysis_" + analysisId + ".json"))
                .onErrorResume(ex -> {
                    log.error("导出JSON失败: {} ({})", analysisId, ex.getMessage());
                    return Mono.just(ApiResponses.errorObject(ex));
                });
    }

    private static ResponseEntity<Object> attachment(String content, MediaType mediaType, String filename) {
        return ResponseEntity.ok()
                .contentType(mediaType)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(content);
    }
}
