package com.example.casa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Data
@Configuration
@ConfigurationProperties(prefix = "casa.storage")
public class FileStorageConfig {

    /** 存储类型：file 或 database */
    private String type = "file";
    private String uploadDir = "uploads";
    private String resultsDir = "results";

    @PostConstruct
    public void init() {
        createDirectoryIfNotExists(uploadDir);
        createDirectoryIfNotExists(resultsDir);
    }

    private void createDirectoryIfNotExists(String directory) {
        try {
            Path path = Paths.get(directory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create directory: " + directory, e);
        }
    }

    public Path getUploadPath() {
        return Paths.get(uploadDir);
    }

    public Path getResultsPath() {
        return Paths.get(resultsDir);
    }
}
