package com.example.casa.service;

import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.exception.PersistenceException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 内存任务存储，可模拟写入失败与阻塞写入
 */
class InMemoryJobStore implements JobStore {

    final Map<String, AnalysisJob> records = new ConcurrentHashMap<>();

    volatile boolean failPuts;

    /** 非空时写入在进入后等待放行 */
    volatile CountDownLatch putGate;

    final CountDownLatch putEntered = new CountDownLatch(1);

    final CountDownLatch storeDeleted = new CountDownLatch(1);

    @Override
    public Mono<AnalysisJob> get(String analysisId) {
        return Mono.fromSupplier(() -> records.get(analysisId));
    }

    @Override
    public Mono<Void> put(AnalysisJob job) {
        return Mono.fromRunnable(() -> {
            putEntered.countDown();
            CountDownLatch gate = putGate;
            if (gate != null) {
                await(gate);
            }
            if (failPuts) {
                throw new PersistenceException("Failed to save analysis " + job.getAnalysisId(),
                        new IOException("disk full"));
            }
            records.put(job.getAnalysisId(), job);
        });
    }

    @Override
    public Mono<Boolean> delete(String analysisId) {
        return Mono.fromSupplier(() -> {
            boolean existed = records.remove(analysisId) != null;
            if (existed) {
                storeDeleted.countDown();
            }
            return existed;
        });
    }

    @Override
    public Flux<AnalysisSummary> listSummaries() {
        return Flux.defer(() -> Flux.fromIterable(records.values()).map(AnalysisSummary::of));
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
