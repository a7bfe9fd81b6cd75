package com.example.casa.service.impl;

import com.example.casa.config.FileStorageConfig;
import com.example.casa.dto.AnalysisJob;
import com.example.casa.dto.AnalysisSummary;
import com.example.casa.exception.PersistenceException;
import com.example.casa.service.JobStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于文件系统的任务存储：每个任务一个JSON文件 results/{id}.json
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "casa.storage", name = "type", havingValue = "file", matchIfMissing = true)
public class FileSystemJobStore implements JobStore {

    private static final String SUFFIX = ".json";

    /** 任务ID只允许字母数字、下划线和短横线 */
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path resultsDir;
    private final ObjectMapper objectMapper;
    private final ObjectReader summaryReader;

    @Autowired
    public FileSystemJobStore(FileStorageConfig storageConfig, ObjectMapper objectMapper) {
        this(storageConfig.getResultsPath(), objectMapper);
    }

    public FileSystemJobStore(Path resultsDir, ObjectMapper objectMapper) {
        this.resultsDir = resultsDir;
        this.objectMapper = objectMapper;
        // 只绑定摘要字段，轨迹与指标被跳过
        this.summaryReader = objectMapper.readerFor(AnalysisSummary.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Mono<AnalysisJob> get(String analysisId) {
        if (!isValidId(analysisId)) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                    Path file = fileOf(analysisId);
                    if (!Files.exists(file)) {
                        return null;
                    }
                    return objectMapper.readValue(file.toFile(), AnalysisJob.class);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class,
                        e -> new PersistenceException("Failed to read analysis " + analysisId, e));
    }

    @Override
    public Mono<Void> put(AnalysisJob job) {
        if (!isValidId(job.getAnalysisId())) {
            return Mono.error(new PersistenceException("Invalid analysis id: " + job.getAnalysisId(), null));
        }
        return Mono.fromCallable(() -> {
                    Files.createDirectories(resultsDir);
                    Path target = fileOf(job.getAnalysisId());
                    Path temp = Files.createTempFile(resultsDir, job.getAnalysisId(), ".tmp");
                    try {
                        objectMapper.writeValue(temp.toFile(), job);
                        moveIntoPlace(temp, target);
                    } finally {
                        Files.deleteIfExists(temp);
                    }
                    log.debug("任务结果已写入: {}", target);
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException("Failed to save analysis " + job.getAnalysisId(), e))
                .then();
    }

    @Override
    public Mono<Boolean> delete(String analysisId) {
        if (!isValidId(analysisId)) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> Files.deleteIfExists(fileOf(analysisId)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class,
                        e -> new PersistenceException("Failed to delete analysis " + analysisId, e));
    }

    @Override
    public Flux<AnalysisSummary> listSummaries() {
        return Mono.fromCallable(this::readSummaries)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    private List<AnalysisSummary> readSummaries() throws IOException {
        if (!Files.isDirectory(resultsDir)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(resultsDir)) {
            files = stream.filter(path -> path.getFileName().toString().endsWith(SUFFIX))
                    .collect(Collectors.toList());
        }
        List<AnalysisSummary> summaries = new ArrayList<>();
        for (Path file : files) {
            try {
                summaries.add(summaryReader.readValue(file.toFile()));
            } catch (IOException e) {
                // 单个损坏文件不影响列表
                log.warn("跳过无法解析的结果文件: {}", file, e);
            }
        }
        return summaries;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("文件系统不支持原子移动，改用普通替换: {}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path fileOf(String analysisId) {
        return resultsDir.resolve(analysisId + SUFFIX);
    }

    private static boolean isValidId(String analysisId) {
        return analysisId != null && ID_PATTERN.matcher(analysisId).matches();
    }
}
