package com.example.casa.service.impl;

import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisStatus;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.dto.AnalysisType;
import com.example.casa.dto.SpermTrack;
import com.example.casa.entity.AnalysisRecord;
import com.example.casa.exception.PersistenceException;
import com.example.casa.repository.AnalysisRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.Before;
import org.junit.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class R2dbcJobStoreTest {

    private FakeRecordRepository repository;
    private R2dbcJobStore store;

    @Before
    public void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new FakeRecordRepository();
        store = new R2dbcJobStore(repository, objectMapper);
    }

    @Test
    public void testRoundTrip() {
        AnalysisJob job = job("db-1", AnalysisStatus.COMPLETED, LocalDateTime.of(2024, 4, 1, 9, 0));

        StepVerifier.create(store.put(job)).verifyComplete();
        AnalysisJob loaded = store.get("db-1").block();

        assertEquals(job, loaded);
        AnalysisRecord record = repository.rows.get("db-1");
        assertEquals("completed", record.getStatus());
        assertEquals("video", record.getAnalysisType());
        assertEquals(job.getCreatedAt(), record.getCreatedAt());
    }

    @Test
    public void testPutOverwritesSameRow() {
        AnalysisJob running = job("db-2", AnalysisStatus.PROCESSING, LocalDateTime.now());
        store.put(running).block();
        long id = repository.rows.get("db-2").getId();

        store.put(running.toBuilder().status(AnalysisStatus.FAILED).message("Analysis failed: x").build()).block();

        assertEquals(1, repository.rows.size());
        assertEquals("主键不变", id, (long) repository.rows.get("db-2").getId());
        assertEquals("failed", repository.rows.get("db-2").getStatus());
        assertEquals(AnalysisStatus.FAILED, store.get("db-2").block().getStatus());
    }

    @Test
    public void testConcurrentPutsForSameJob() {
        AnalysisJob job = job("db-3", AnalysisStatus.COMPLETED, LocalDateTime.now());

        // 完成写入与重试写入同时发生
        Flux.range(0, 16)
                .flatMap(i -> store.put(job.toBuilder().message("write " + i).build())
                        .subscribeOn(Schedulers.parallel()))
                .blockLast();

        assertEquals(1, repository.rows.size());
        assertNotNull(store.get("db-3").block());
    }

    @Test
    public void testDeleteTwice() {
        store.put(job("db-4", AnalysisStatus.COMPLETED, LocalDateTime.now())).block();

        StepVerifier.create(store.delete("db-4")).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete("db-4")).expectNext(false).verifyComplete();
        StepVerifier.create(store.get("db-4")).verifyComplete();
    }

    @Test
    public void testCorruptSnapshot() {
        AnalysisRecord record = new AnalysisRecord();
        record.setId(99L);
        record.setAnalysisId("db-5");
        record.setStatus("completed");
        record.setAnalysisType("image");
        record.setFilename("db-5.png");
        record.setSnapshot("{\"analysisId\": ");
        record.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        repository.rows.put("db-5", record);

        StepVerifier.create(store.get("db-5"))
                .expectError(PersistenceException.class)
                .verify();

        // 列表只读索引列，不受损坏快照影响
        AnalysisSummary summary = store.listSummaries().blockFirst();
        assertNotNull(summary);
        assertEquals("db-5", summary.getAnalysisId());
        assertEquals(AnalysisType.IMAGE, summary.getAnalysisType());
        assertEquals(AnalysisStatus.COMPLETED, summary.getStatus());
    }

    @Test
    public void testListSummariesNewestFirst() {
        LocalDateTime base = LocalDateTime.of(2024, 6, 1, 12, 0);
        store.put(job("old", AnalysisStatus.COMPLETED, base)).block();
        store.put(job("new", AnalysisStatus.FAILED, base.plusDays(1))).block();

        List<AnalysisSummary> summaries = store.listSummaries().collectList().block();

        assertEquals(2, summaries.size());
        assertEquals("new", summaries.get(0).getAnalysisId());
        assertEquals(AnalysisStatus.FAILED, summaries.get(0).getStatus());
        assertEquals("old.mp4", summaries.get(1).getFilename());
    }

    @Test
    public void testRepositoryFailureIsPersistenceError() {
        repository.failWrites = true;

        StepVerifier.create(store.put(job("db-6", AnalysisStatus.COMPLETED, LocalDateTime.now())))
                .expectError(PersistenceException.class)
                .verify();
    }

    private static AnalysisJob job(String id, AnalysisStatus status, LocalDateTime createdAt) {
        return AnalysisJob.builder()
                .analysisId(id)
                .filePath("/data/" + id + ".mp4")
                .filename(id + ".mp4")
                .analysisType(AnalysisType.VIDEO)
                .status(status)
                .progress(status.isTerminal() ? 100.0 : 40.0)
                .createdAt(createdAt)
                .tracks(List.of(SpermTrack.builder().trackId(1).detections(List.of()).rejectionReason("short").build()))
                .parametersUsed(Map.of("confidence", 0.5))
                .build();
    }

    /**
     * 内存表，upsert 按 analysis_id 唯一键合并
     */
    static class FakeRecordRepository implements AnalysisRecordRepository {

        final Map<String, AnalysisRecord> rows = new ConcurrentHashMap<>();
        final AtomicLong sequence = new AtomicLong();
        volatile boolean failWrites;

        @Override
        public Mono<AnalysisRecord> findByAnalysisId(String analysisId) {
            return Mono.fromSupplier(() -> rows.get(analysisId));
        }

        @Override
        public Flux<AnalysisRecord> findSummariesOrderByCreatedAtDesc() {
            return Flux.defer(() -> Flux.fromIterable(rows.values()))
                    .map(row -> {
                        AnalysisRecord summary = new AnalysisRecord();
                        summary.setId(row.getId());
                        summary.setAnalysisId(row.getAnalysisId());
                        summary.setStatus(row.getStatus());
                        summary.setAnalysisType(row.getAnalysisType());
                        summary.setFilename(row.getFilename());
                        summary.setCreatedAt(row.getCreatedAt());
                        summary.setUpdatedAt(row.getUpdatedAt());
                        return summary;
                    })
                    .sort(Comparator.comparing(AnalysisRecord::getCreatedAt).reversed());
        }

        @Override
        public Mono<Integer> upsert(String analysisId, String status, String analysisType, String filename,
                                    String snapshot, LocalDateTime createdAt, LocalDateTime updatedAt) {
            return Mono.fromSupplier(() -> {
                if (failWrites) {
                    throw new IllegalStateException("connection reset");
                }
                rows.compute(analysisId, (key, existing) -> {
                    AnalysisRecord row = existing;
                    if (row == null) {
                        row = new AnalysisRecord();
                        row.setId(sequence.incrementAndGet());
                        row.setAnalysisId(analysisId);
                        row.setAnalysisType(analysisType);
                        row.setFilename(filename);
                        row.setCreatedAt(createdAt);
                    }
                    row.setStatus(status);
                    row.setSnapshot(snapshot);
                    row.setUpdatedAt(updatedAt);
                    return row;
                });
                return 1;
            });
        }

        @Override
        public Mono<Integer> deleteByAnalysisId(String analysisId) {
            return Mono.fromSupplier(() -> rows.remove(analysisId) != null ? 1 : 0);
        }

        @Override
        public <S extends AnalysisRecord> Mono<S> save(S entity) {
            return Mono.error(new UnsupportedOperationException("save"));
        }

        @Override
        public <S extends AnalysisRecord> Flux<S> saveAll(Iterable<S> entities) {
            return Flux.error(new UnsupportedOperationException("saveAll"));
        }

        @Override
        public <S extends AnalysisRecord> Flux<S> saveAll(Publisher<S> entityStream) {
            return Flux.error(new UnsupportedOperationException("saveAll"));
        }

        @Override
        public Mono<AnalysisRecord> findById(Long id) {
            return Flux.fromIterable(rows.values()).filter(row -> id.equals(row.getId())).next();
        }

        @Override
        public Mono<AnalysisRecord> findById(Publisher<Long> id) {
            return Mono.from(id).flatMap(value -> findById(value));
        }

        @Override
        public Mono<Boolean> existsById(Long id) {
            return findById(id).hasElement();
        }

        @Override
        public Mono<Boolean> existsById(Publisher<Long> id) {
            return Mono.from(id).flatMap(value -> existsById(value));
        }

        @Override
        public Flux<AnalysisRecord> findAll() {
            return Flux.defer(() -> Flux.fromIterable(rows.values()));
        }

        @Override
        public Flux<AnalysisRecord> findAllById(Iterable<Long> ids) {
            return Flux.fromIterable(ids).flatMap(value -> findById(value));
        }

        @Override
        public Flux<AnalysisRecord> findAllById(Publisher<Long> idStream) {
            return Flux.from(idStream).flatMap(value -> findById(value));
        }

        @Override
        public Mono<Long> count() {
            return Mono.fromSupplier(() -> (long) rows.size());
        }

        @Override
        public Mono<Void> deleteById(Long id) {
            return Mono.fromRunnable(() -> rows.values().removeIf(row -> id.equals(row.getId())));
        }

        @Override
        public Mono<Void> deleteById(Publisher<Long> id) {
            return Mono.from(id).flatMap(value -> deleteById(value));
        }

        @Override
        public Mono<Void> delete(AnalysisRecord entity) {
            return deleteById(entity.getId());
        }

        @Override
        public Mono<Void> deleteAllById(Iterable<? extends Long> ids) {
            return Flux.<Long>fromIterable(ids).flatMap(value -> deleteById(value)).then();
        }

        @Override
        public Mono<Void> deleteAll(Iterable<? extends AnalysisRecord> entities) {
            return Flux.fromIterable(entities).flatMap(this::delete).then();
        }

        @Override
        public Mono<Void> deleteAll(Publisher<? extends AnalysisRecord> entityStream) {
            return Flux.from(entityStream).flatMap(this::delete).then();
        }

        @Override
        public Mono<Void> deleteAll() {
            return Mono.fromRunnable(rows::clear);
        }
    }
}
