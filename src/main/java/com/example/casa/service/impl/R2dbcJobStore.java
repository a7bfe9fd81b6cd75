package com.example.casa.service.impl;

import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisStatus;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.dto.AnalysisType;
import com.example.casa.entity.AnalysisRecord;
import com.example.casa.exception.PersistenceException;
import com.example.casa.repository.AnalysisRecordRepository;
import com.example.casa.service.JobStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * 基于R2DBC的任务存储，快照以JSON文本保存在 analysis_records 表
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "casa.storage", name = "type", havingValue = "database")
public class R2dbcJobStore implements JobStore {

    private final AnalysisRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<AnalysisJob> get(String analysisId) {
        return repository.findByAnalysisId(analysisId)
                .map(this::toJob)
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to read analysis " + analysisId, e));
    }

    /**
     * 单条语句插入或覆盖，同一任务的并发写入不会触发唯一键冲突
     */
    @Override
    public Mono<Void> put(AnalysisJob job) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(job))
                .flatMap(snapshot -> repository.upsert(
                        job.getAnalysisId(),
                        job.getStatus().label(),
                        job.getAnalysisType() != null ? job.getAnalysisType().name().toLowerCase() : null,
                        job.getFilename(),
                        snapshot,
                        job.getCreatedAt() != null ? job.getCreatedAt() : LocalDateTime.now(),
                        LocalDateTime.now()))
                .doOnSuccess(rows -> log.info("任务记录已保存: {}", job.getAnalysisId()))
                .onErrorMap(e -> new PersistenceException("Failed to save analysis " + job.getAnalysisId(), e))
                .then();
    }

    @Override
    public Mono<Boolean> delete(String analysisId) {
        return repository.deleteByAnalysisId(analysisId)
                .map(rows -> rows > 0)
                .defaultIfEmpty(false)
                .onErrorMap(e -> new PersistenceException("Failed to delete analysis " + analysisId, e));
    }

    @Override
    public Flux<AnalysisSummary> listSummaries() {
        return repository.findSummariesOrderByCreatedAtDesc()
                .map(R2dbcJobStore::toSummary)
                .onErrorMap(e -> new PersistenceException("Failed to list analyses", e));
    }

    static AnalysisSummary toSummary(AnalysisRecord record) {
        return AnalysisSummary.builder()
                .analysisId(record.getAnalysisId())
                .status(AnalysisStatus.fromLabel(record.getStatus()))
                .analysisType(AnalysisType.parse(record.getAnalysisType()))
                .filename(record.getFilename())
                .createdAt(record.getCreatedAt())
                .build();
    }

    private AnalysisJob toJob(AnalysisRecord record) {
        try {
            return objectMapper.readValue(record.getSnapshot(), AnalysisJob.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupted snapshot for analysis " + record.getAnalysisId(), e);
        }
    }
}
