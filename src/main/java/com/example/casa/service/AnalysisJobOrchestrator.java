package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisOutcome;
import com.example.casa.dto.AnalysisRequest;
import com.example.casa.dto.AnalysisStatus;
import com.example.casa.dto.AnalysisStatusView;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.dto.AnalysisTask;
import com.example.casa.dto.AnalysisType;
import com.example.casa.dto.CasaMetrics;
import com.example.casa.dto.ImageDetectionData;
import com.example.casa.dto.MediaInfo;
import com.example.casa.dto.QualityAssessment;
import com.example.casa.dto.SpermTrack;
import com.example.casa.dto.VideoTrackingData;
import com.example.casa.exception.AnalysisNotFoundException;
import com.example.casa.exception.AnalysisNotReadyException;
import com.example.casa.exception.CasaAnalysisException;
import com.example.casa.exception.ErrorCategory;
import com.example.casa.exception.JobStateException;
import com.example.casa.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 分析任务编排：维护任务表与状态机 pending → processing → completed | failed。
 * 同一任务的所有状态修改在其句柄上串行化，终态只能被认领一次
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisJobOrchestrator {

    static final String MSG_INITIALIZING = "Initializing analysis...";
    static final String MSG_LOADING = "Loading file...";
    static final String MSG_CALCULATING = "Calculating CASA metrics...";
    static final String MSG_SAVING = "Saving results...";
    static final String MSG_COMPLETE = "Analysis complete!";

    private final Map<String, JobHandle> jobs = new ConcurrentHashMap<>();

    private final JobStore store;
    private final ResultCache cache;
    private final MediaProbe mediaProbe;
    private final SpermTrackingClient trackingClient;
    private final TrackAnalyzer trackAnalyzer;
    private final PopulationAggregator aggregator;
    private final SampleMetricsCalculator sampleMetrics;
    private final QualityAssessmentEngine assessmentEngine;
    private final CasaProperties properties;

    /**
     * 创建任务并在后台启动分析流水线
     */
    public AnalysisTask submit(AnalysisRequest request) {
        if (request == null || request.getFilePath() == null || request.getFilePath().isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        AnalysisType type = request.getAnalysisType() != null ? request.getAnalysisType() : AnalysisType.VIDEO;

        String analysisId = UUID.randomUUID().toString();
        Path file = Paths.get(request.getFilePath());
        String filename = request.getFilename() != null
                ? request.getFilename()
                : String.valueOf(file.getFileName());
        Map<String, Object> parameters = request.getParameters() != null
                ? new HashMap<>(request.getParameters())
                : new HashMap<>();

        AnalysisJob job = AnalysisJob.builder()
                .analysisId(analysisId)
                .filePath(request.getFilePath())
                .filename(filename)
                .analysisType(type)
                .status(AnalysisStatus.PENDING)
                .progress(0.0)
                .message("Analysis queued")
                .createdAt(LocalDateTime.now())
                .tracks(List.of())
                .parametersUsed(parameters)
                .build();

        JobHandle handle = new JobHandle(job);
        jobs.put(analysisId, handle);

        synchronized (handle) {
            handle.job = handle.job.toBuilder()
                    .status(AnalysisStatus.PROCESSING)
                    .message(MSG_INITIALIZING)
                    .build();
        }
        log.info("分析任务已提交: {} ({}, {})", analysisId, filename, type.name().toLowerCase());

        Mono.defer(() -> runPipeline(analysisId, file, type))
                .onErrorResume(error -> !(error instanceof JobStateException), error -> fail(analysisId, error))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        finished -> log.info("分析任务结束: {} -> {}", analysisId, finished.getStatus().label()),
                        error -> log.info("分析任务中止: {} ({})", analysisId, error.getMessage()));

        return new AnalysisTask(analysisId, handle.completion);
    }

    /**
     * 更新进度：限制在[0, 100]，只增不减；终态或未知任务拒绝写入
     */
    public void advanceProgress(String analysisId, double percent, String message) {
        JobHandle handle = jobs.get(analysisId);
        if (handle == null) {
            throw new JobStateException("Unknown analysis: " + analysisId);
        }
        synchronized (handle) {
            ensureWritable(handle, analysisId);
            double clamped = Double.isNaN(percent) ? 0.0 : Math.max(0.0, Math.min(100.0, percent));
            AnalysisJob.AnalysisJobBuilder builder = handle.job.toBuilder()
                    .progress(Math.max(handle.job.getProgress(), clamped));
            if (message != null) {
                builder.message(message);
            }
            handle.job = builder.build();
        }
        log.debug("任务进度: {} {}% {}", analysisId, percent, message);
    }

    /**
     * 认领完成状态，先持久化再发布。持久化失败时任务仍为completed并带失败标记
     */
    public Mono<AnalysisJob> complete(String analysisId, AnalysisOutcome outcome) {
        return Mono.defer(() -> {
            JobHandle handle = requireHandle(analysisId);
            AnalysisJob snapshot;
            synchronized (handle) {
                ensureWritable(handle, analysisId);
                handle.finalizing = true;
                snapshot = handle.job.toBuilder()
                        .status(AnalysisStatus.COMPLETED)
                        .progress(100.0)
                        .message(MSG_COMPLETE)
                        .completedAt(LocalDateTime.now())
                        .processingTime(handle.elapsedSeconds())
                        .fileSize(outcome.getFileSize())
                        .tracks(outcome.getTracks() != null ? outcome.getTracks() : List.of())
                        .casaMetrics(outcome.getCasaMetrics())
                        .videoMetrics(outcome.getVideoMetrics())
                        .imageMetrics(outcome.getImageMetrics())
                        .assessment(outcome.getAssessment())
                        .modelVersion(outcome.getModelVersion())
                        .errorMessage(null)
                        .errorCategory(null)
                        .persistenceFailed(false)
                        .build();
            }

            return store.put(snapshot)
                    .thenReturn(snapshot)
                    .onErrorResume(error -> {
                        log.error("分析结果持久化失败: {}", analysisId, error);
                        return Mono.just(snapshot.toBuilder()
                                .persistenceFailed(true)
                                .errorCategory(ErrorCategory.PERSISTENCE)
                                .errorMessage("Results could not be saved: " + describe(error))
                                .build());
                    })
                    .flatMap(finished -> publishTerminal(handle, finished));
        });
    }

    /**
     * 记录最具体的失败原因并进入failed，不暴露部分结果
     */
    public Mono<AnalysisJob> fail(String analysisId, Throwable error) {
        return Mono.defer(() -> {
            JobHandle handle = requireHandle(analysisId);
            ErrorCategory category = CasaAnalysisException.categoryOf(error);
            String cause = describe(error);
            AnalysisJob snapshot;
            synchronized (handle) {
                ensureWritable(handle, analysisId);
                handle.finalizing = true;
                snapshot = handle.job.toBuilder()
                        .status(AnalysisStatus.FAILED)
                        .message("Analysis failed: " + cause)
                        .completedAt(LocalDateTime.now())
                        .processingTime(handle.elapsedSeconds())
                        .errorMessage(cause)
                        .errorCategory(category)
                        .build();
            }
            if (category == ErrorCategory.INTERNAL) {
                log.error("分析任务失败: {} [{}]", analysisId, category, error);
            } else {
                log.warn("分析任务失败: {} [{}] {}", analysisId, category, cause);
            }

            return store.put(snapshot)
                    .thenReturn(snapshot)
                    .onErrorResume(persistError -> {
                        log.error("失败状态持久化失败: {}", analysisId, persistError);
                        return Mono.just(snapshot.toBuilder().persistenceFailed(true).build());
                    })
                    .flatMap(finished -> publishTerminal(handle, finished));
        });
    }

    /**
     * 重新写入持久化失败的终态任务
     */
    public Mono<AnalysisJob> retryPersistence(String analysisId) {
        return Mono.defer(() -> {
            JobHandle handle = jobs.get(analysisId);
            if (handle == null) {
                return findJob(analysisId)
                        .switchIfEmpty(Mono.error(new AnalysisNotFoundException(analysisId)));
            }
            AnalysisJob job;
            synchronized (handle) {
                if (handle.deleted) {
                    return Mono.error(new AnalysisNotFoundException(analysisId));
                }
                job = handle.job;
            }
            if (!job.getStatus().isTerminal()) {
                return Mono.error(new AnalysisNotReadyException(analysisId, job.getStatus()));
            }
            if (!job.isPersistenceFailed()) {
                return Mono.just(job);
            }

            boolean completed = job.getStatus() == AnalysisStatus.COMPLETED;
            AnalysisJob repaired = job.toBuilder()
                    .persistenceFailed(false)
                    .errorCategory(completed ? null : job.getErrorCategory())
                    .errorMessage(completed ? null : job.getErrorMessage())
                    .build();
            log.info("重新持久化任务结果: {}", analysisId);
            return store.put(repaired)
                    .then(Mono.defer(() -> publishTerminal(handle, repaired)));
        });
    }

    public Mono<AnalysisStatusView> getStatus(String analysisId) {
        return findJob(analysisId)
                .map(AnalysisStatusView::of)
                .switchIfEmpty(Mono.error(new AnalysisNotFoundException(analysisId)));
    }

    /**
     * 仅在completed时返回结果
     */
    public Mono<AnalysisJob> getResult(String analysisId) {
        return findJob(analysisId)
                .switchIfEmpty(Mono.error(new AnalysisNotFoundException(analysisId)))
                .flatMap(job -> job.getStatus() == AnalysisStatus.COMPLETED
                        ? Mono.just(job)
                        : Mono.error(new AnalysisNotReadyException(analysisId, job.getStatus())));
    }

    /**
     * 已完成视频任务的质量评估，图像任务为空
     */
    public Mono<QualityAssessment> getAssessment(String analysisId) {
        return getResult(analysisId)
                .flatMap(job -> Mono.justOrEmpty(job.getAssessment()));
    }

    /**
     * 删除任务表、缓存与持久化记录。首次删除返回true，再次删除返回false
     */
    public Mono<Boolean> delete(String analysisId) {
        return Mono.defer(() -> {
            boolean removed = false;
            JobHandle handle = jobs.remove(analysisId);
            if (handle != null) {
                synchronized (handle) {
                    if (!handle.deleted) {
                        handle.deleted = true;
                        removed = true;
                    }
                }
                handle.completion.completeExceptionally(new AnalysisNotFoundException(analysisId));
            }
            boolean cached = cache.get(analysisId).isPresent();
            cache.invalidate(analysisId);

            boolean inMemory = removed || cached;
            return store.delete(analysisId)
                    .map(stored -> stored || inMemory)
                    .doOnNext(deleted -> {
                        if (deleted) {
                            log.info("分析任务已删除: {}", analysisId);
                        }
                    });
        });
    }

    /**
     * 内存任务与持久化任务合并去重，按创建时间倒序
     */
    public Flux<AnalysisSummary> list() {
        return Flux.defer(() -> {
            List<AnalysisSummary> active = jobs.values().stream()
                    .map(JobHandle::visibleJob)
                    .filter(Objects::nonNull)
                    .map(AnalysisSummary::of)
                    .collect(Collectors.toList());
            Set<String> activeIds = active.stream()
                    .map(AnalysisSummary::getAnalysisId)
                    .collect(Collectors.toSet());

            Flux<AnalysisSummary> stored = store.listSummaries()
                    .filter(summary -> !activeIds.contains(summary.getAnalysisId()))
                    .onErrorResume(error -> {
                        log.warn("读取持久化任务列表失败，仅返回内存中的任务", error);
                        return Flux.empty();
                    });

            return Flux.fromIterable(active)
                    .concatWith(stored)
                    .sort(Comparator.comparing(AnalysisSummary::getCreatedAt,
                            Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        });
    }

    private Mono<AnalysisJob> runPipeline(String analysisId, Path file, AnalysisType type) {
        advanceProgress(analysisId, 10, MSG_LOADING);
        return Mono.defer(() -> mediaProbe.probe(file, type))
                .flatMap(media -> type == AnalysisType.IMAGE
                        ? analyzeImage(analysisId, file, media)
                        : analyzeVideo(analysisId, file, media))
                .flatMap(outcome -> {
                    advanceProgress(analysisId, 90, MSG_SAVING);
                    return complete(analysisId, outcome);
                });
    }

    private Mono<AnalysisOutcome> analyzeVideo(String analysisId, Path file, MediaInfo media) {
        return Mono.defer(() -> trackingClient.trackVideo(file))
                .switchIfEmpty(Mono.error(new UpstreamException("Tracking service unavailable: empty response")))
                .flatMap(data -> {
                    advanceProgress(analysisId, 60, MSG_CALCULATING);
                    return trackAnalyzer.analyzeAll(data.getTracks())
                            .map(tracks -> videoOutcome(analysisId, media, data, tracks));
                });
    }

    private AnalysisOutcome videoOutcome(String analysisId, MediaInfo media, VideoTrackingData data,
                                         List<SpermTrack> tracks) {
        CasaMetrics metrics = aggregator.aggregate(tracks);
        long rejected = tracks.stream().filter(track -> !track.hasKinematics()).count();
        if (rejected > 0) {
            log.info("任务 {}: {} 条轨迹未参与统计", analysisId, rejected);
        }
        log.info("任务 {}: 有效轨迹 {}, PR {}%, 总活力 {}%", analysisId, metrics.getTotalCount(),
                String.format("%.1f", metrics.getProgressiveMotility()),
                String.format("%.1f", metrics.getTotalMotility()));

        return AnalysisOutcome.builder()
                .casaMetrics(metrics)
                .tracks(tracks)
                .videoMetrics(sampleMetrics.videoMetrics(media, data.getFrames()))
                .assessment(assessmentEngine.assess(metrics, properties.referenceThresholds()))
                .fileSize(media.getFileSize())
                .modelVersion(modelVersionOf(data.getModelVersion()))
                .build();
    }

    private Mono<AnalysisOutcome> analyzeImage(String analysisId, Path file, MediaInfo media) {
        return Mono.defer(() -> trackingClient.detectImage(file))
                .switchIfEmpty(Mono.error(new UpstreamException("Tracking service unavailable: empty response")))
                .map(data -> {
                    advanceProgress(analysisId, 60, MSG_CALCULATING);
                    return imageOutcome(media, data);
                });
    }

    private AnalysisOutcome imageOutcome(MediaInfo media, ImageDetectionData data) {
        return AnalysisOutcome.builder()
                .casaMetrics(sampleMetrics.imagePopulation(data.getDetections(), media))
                .tracks(List.of())
                .imageMetrics(sampleMetrics.imageMetrics(data.getDetections(), media))
                .fileSize(media.getFileSize())
                .modelVersion(modelVersionOf(data.getModelVersion()))
                .build();
    }

    private String modelVersionOf(String reported) {
        return reported != null && !reported.isBlank() ? reported : properties.getTracking().getModelVersion();
    }

    /**
     * 发布终态快照；若任务在持久化期间被删除，则清除刚写入的记录
     */
    private Mono<AnalysisJob> publishTerminal(JobHandle handle, AnalysisJob finished) {
        String analysisId = finished.getAnalysisId();
        boolean deleted;
        synchronized (handle) {
            deleted = handle.deleted;
            if (!deleted) {
                handle.job = finished;
                if (!finished.isPersistenceFailed()) {
                    cache.put(finished);
                    jobs.remove(analysisId, handle);
                }
            }
        }

        if (deleted) {
            log.info("任务在完成前已被删除，清理已写入的记录: {}", analysisId);
            return store.delete(analysisId)
                    .onErrorResume(error -> {
                        log.error("清理已删除任务的记录失败: {}", analysisId, error);
                        return Mono.just(false);
                    })
                    .then(Mono.error(new JobStateException("Analysis was deleted: " + analysisId)));
        }

        handle.completion.complete(finished);
        return Mono.just(finished);
    }

    private Mono<AnalysisJob> findJob(String analysisId) {
        return Mono.defer(() -> {
            JobHandle handle = jobs.get(analysisId);
            if (handle != null) {
                AnalysisJob job = handle.visibleJob();
                if (job != null) {
                    return Mono.just(job);
                }
            }
            Optional<AnalysisJob> cached = cache.get(analysisId);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return store.get(analysisId)
                    .doOnNext(job -> {
                        if (job.getStatus() != null && job.getStatus().isTerminal()) {
                            cache.put(job);
                        }
                    });
        });
    }

    private JobHandle requireHandle(String analysisId) {
        JobHandle handle = jobs.get(analysisId);
        if (handle == null) {
            throw new JobStateException("Unknown analysis: " + analysisId);
        }
        return handle;
    }

    private static void ensureWritable(JobHandle handle, String analysisId) {
        if (handle.deleted) {
            throw new JobStateException("Analysis was deleted: " + analysisId);
        }
        if (handle.finalizing || handle.job.getStatus().isTerminal()) {
            throw new JobStateException("Analysis already finished: " + analysisId);
        }
    }

    /**
     * 异常链中最具体的业务异常消息
     */
    static String describe(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CasaAnalysisException) {
                return current.getMessage();
            }
            current = current.getCause();
        }
        String message = error.getMessage();
        return "Internal error: " + (message != null ? message : error.getClass().getSimpleName());
    }

    private static final class JobHandle {

        private final CompletableFuture<AnalysisJob> completion = new CompletableFuture<>();
        private final long startNanos = System.nanoTime();

        private AnalysisJob job;
        private boolean finalizing;
        private boolean deleted;

        private JobHandle(AnalysisJob job) {
            this.job = job;
        }

        private synchronized AnalysisJob visibleJob() {
            return deleted ? null : job;
        }

        private double elapsedSeconds() {
            return (System.nanoTime() - startNanos) / 1_000_000_000.0;
        }
    }
}
