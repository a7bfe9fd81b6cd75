package com.example.casa.controller;

import com.example.casa.config.CasaProperties;
import com.example.casa.config.FileStorageConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.File;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/casa/health")
@RequiredArgsConstructor
public class HealthController {

    private final CasaProperties properties;
    private final FileStorageConfig storageConfig;

    @Value("${spring.application.name:casa-analyzer}")
    private String applicationName;

    /**
     * 服务状态检查
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();
            status.put("applicationName", applicationName);
            status.put("status", "RUNNING");
            status.put("timestamp", LocalDateTime.now().toString());
            status.put("storageType", storageConfig.getType());
            status.put("trackingServiceUrl", properties.getTracking().getBaseUrl());
            status.put("modelVersion", properties.getTracking().getModelVersion());

            // 存储信息
            File resultsDirectory = storageConfig.getResultsPath().toFile();
            Map<String, Object> storageInfo = new HashMap<>();
            storageInfo.put("resultsDir", resultsDirectory.getAbsolutePath());
            storageInfo.put("freeSpace", resultsDirectory.getFreeSpace());
            storageInfo.put("totalSpace", resultsDirectory.getTotalSpace());
            status.put("storage", storageInfo);

            return ResponseEntity.ok(status);
        });
    }
}
