package com.example.casa.controller;

import com.example.casa.config.FileStorageConfig;
import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisRequest;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.dto.AnalysisTask;
import com.example.casa.dto.AnalysisType;
import com.example.casa.service.AnalysisJobOrchestrator;
import com.example.casa.util.ApiResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/casa")
@RequiredArgsConstructor
public class AnalysisController {

    // 支持的视频格式
    private static final List<String> SUPPORTED_VIDEO_FORMATS = List.of("mp4", "avi", "mov", "mkv");

    // 支持的图像格式
    private static final List<String> SUPPORTED_IMAGE_FORMATS = List.of("jpg", "jpeg", "png", "bmp", "tiff");

    private final AnalysisJobOrchestrator orchestrator;
    private final FileStorageConfig storageConfig;

    /**
     * 上传样本并提交分析
     */
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> analyze(
            @RequestPart("file") Mono<FilePart> filePartMono,
            @RequestPart(value = "analysisType", required = false) String analysisType) {
        return Mono.fromCallable(() -> AnalysisType.parse(analysisType))
                .zipWith(filePartMono)
                .flatMap(tuple -> saveUpload(tuple.getT2(), tuple.getT1())
                        .map(savePath -> AnalysisRequest.builder()
                                .filePath(savePath.toString())
                                .filename(tuple.getT2().filename())
                                .analysisType(tuple.getT1())
                                .build()))
                .map(orchestrator::submit)
                .map(task -> ResponseEntity.ok(submitted(task)))
                .onErrorResume(ex -> {
                    log.error("提交分析失败: {}", ex.getMessage());
                    return Mono.just(ApiResponses.errorEntity(ex));
                });
    }

    @GetMapping("/analysis/{analysisId}/status")
    public Mono<ResponseEntity<Object>> getStatus(@PathVariable String analysisId) {
        return orchestrator.getStatus(analysisId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(ex -> Mono.just(ApiResponses.errorObject(ex)));
    }

    @GetMapping("/analysis/{analysisId}/results")
    public Mono<ResponseEntity<Object>> getResults(@PathVariable String analysisId) {
        return orchestrator.getResult(analysisId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(ex -> Mono.just(ApiResponses.errorObject(ex)));
    }

    @GetMapping("/analysis/{analysisId}/assessment")
    public Mono<ResponseEntity<Object>> getAssessment(@PathVariable String analysisId) {
        return orchestrator.getAssessment(analysisId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .switchIfEmpty(Mono.fromSupplier(() -> ResponseEntity.status(404)
                        .<Object>body(ApiResponses.error("No quality assessment for analysis " + analysisId))))
                .onErrorResume(ex -> Mono.just(ApiResponses.errorObject(ex)));
    }

    /**
     * 重新持久化结果
     */
    @PostMapping("/analysis/{analysisId}/persist")
    public Mono<ResponseEntity<Object>> retryPersistence(@PathVariable String analysisId) {
        return orchestrator.retryPersistence(analysisId)
                .map(AnalysisJob::isPersistenceFailed)
                .<ResponseEntity<Object>>map(failed -> {
                    Map<String, Object> result = ApiResponses.success();
                    result.put("analysisId", analysisId);
                    result.put("persisted", !failed);
                    return ResponseEntity.ok(result);
                })
                .onErrorResume(ex -> {
                    log.error("重新持久化失败: {}", analysisId, ex);
                    return Mono.just(ApiResponses.errorObject(ex));
                });
    }

    @DeleteMapping("/analysis/{analysisId}")
    public Mono<ResponseEntity<Map<String, Object>>> delete(@PathVariable String analysisId) {
        return orchestrator.delete(analysisId)
                .map(deleted -> {
                    if (!deleted) {
                        return ResponseEntity.status(404)
                                .body(ApiResponses.error("Analysis not found: " + analysisId));
                    }
                    Map<String, Object> result = ApiResponses.success();
                    result.put("message", "Analysis deleted");
                    result.put("analysisId", analysisId);
                    return ResponseEntity.ok(result);
                })
                .onErrorResume(ex -> {
                    log.error("删除分析失败: {}", analysisId, ex);
                    return Mono.just(ApiResponses.errorEntity(ex));
                });
    }

    @GetMapping("/analysis/list")
    public Mono<ResponseEntity<Map<String, Object>>> list() {
        return orchestrator.list()
                .collectList()
                .map(analyses -> {
                    Map<String, Object> result = ApiResponses.success();
                    result.put("analyses", analyses);
                    result.put("total", analyses.size());
                    return ResponseEntity.ok(result);
                })
                .onErrorResume(ex -> Mono.just(ApiResponses.errorEntity(ex)));
    }

    private Map<String, Object> submitted(AnalysisTask task) {
        Map<String, Object> response = ApiResponses.success();
        response.put("analysisId", task.getAnalysisId());
        response.put("status", "processing");
        response.put("message", "Analysis started");
        return response;
    }

    /**
     * 保存上传文件到 uploads/{type}/
     */
    private Mono<Path> saveUpload(FilePart filePart, AnalysisType type) {
        return Mono.fromCallable(() -> {
                    String extension = getFileExtension(filePart.filename()).toLowerCase();
                    List<String> supported = type == AnalysisType.IMAGE ? SUPPORTED_IMAGE_FORMATS : SUPPORTED_VIDEO_FORMATS;
                    if (!supported.contains(extension)) {
                        throw new IllegalArgumentException("Unsupported file format: " + extension);
                    }
                    Path dir = storageConfig.getUploadPath().resolve(type.name().toLowerCase());
                    Files.createDirectories(dir);
                    return dir.resolve(UUID.randomUUID() + "." + extension);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(savePath -> DataBufferUtils.write(filePart.content(), savePath)
                        .then(Mono.fromCallable(() -> {
                            log.info("文件保存成功: {} ({}字节)", savePath, Files.size(savePath));
                            return savePath;
                        })));
    }

    private static String getFileExtension(String filename) {
        if (filename == null || filename.lastIndexOf('.') == -1) {
            return "";
        }
        return filename.substring(filename.lastIndexOf('.') + 1);
    }
}
