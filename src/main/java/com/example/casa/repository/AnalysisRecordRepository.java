package com.example.casa.repository;

import com.example.casa.entity.AnalysisRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface AnalysisRecordRepository extends ReactiveCrudRepository<AnalysisRecord, Long> {

    // 根据任务ID查询
    Mono<AnalysisRecord> findByAnalysisId(String analysisId);

    // 列表只取索引列，不读取快照
    @Query("SELECT id, analysis_id, status, analysis_type, filename, created_at, updated_at "
            + "FROM analysis_records ORDER BY created_at DESC")
    Flux<AnalysisRecord> findSummariesOrderByCreatedAtDesc();

    // 按任务ID插入或覆盖，依赖 uk_analysis_id 唯一键
    @Modifying
    @Query("INSERT INTO analysis_records (analysis_id, status, analysis_type, filename, snapshot, created_at, updated_at) "
            + "VALUES (:analysisId, :status, :analysisType, :filename, :snapshot, :createdAt, :updatedAt) "
            + "ON DUPLICATE KEY UPDATE status = VALUES(status), snapshot = VALUES(snapshot), updated_at = VALUES(updated_at)")
    Mono<Integer> upsert(String analysisId, String status, String analysisType, String filename,
                         String snapshot, LocalDateTime createdAt, LocalDateTime updatedAt);

    @Modifying
    @Query("DELETE FROM analysis_records WHERE analysis_id = :analysisId")
    Mono<Integer> deleteByAnalysisId(String analysisId);
}
