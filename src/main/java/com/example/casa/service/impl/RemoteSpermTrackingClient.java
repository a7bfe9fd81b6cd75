package com.example.casa.service.impl;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.ImageDetectionData;
import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.VideoTrackingData;
import com.example.casa.exception.UpstreamException;
import com.example.casa.service.SpermTrackingClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通过HTTP调用检测/跟踪模型服务：文件以multipart上传，返回JSON结果
 */
@Slf4j
@Service
public class RemoteSpermTrackingClient implements SpermTrackingClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CasaProperties.Tracking tracking;

    public RemoteSpermTrackingClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                     CasaProperties properties) {
        this.tracking = properties.getTracking();
        this.webClient = webClientBuilder
                .baseUrl(tracking.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<VideoTrackingData> trackVideo(Path video) {
        log.info("提交视频到跟踪服务: {}", video.getFileName());
        return post("/track/video", video)
                .map(this::parseVideoResult)
                .doOnNext(data -> log.info("跟踪完成: {} 帧, {} 条轨迹",
                        data.getFrames().size(), data.getTracks().size()));
    }

    @Override
    public Mono<ImageDetectionData> detectImage(Path image) {
        log.info("提交图像到检测服务: {}", image.getFileName());
        return post("/detect/image", image)
                .map(this::parseImageResult)
                .doOnNext(data -> log.info("检测完成: {} 个目标", data.getDetections().size()));
    }

    private Mono<String> post(String uri, Path file) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new FileSystemResource(file));

        return webClient.post()
                .uri(uri)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(tracking.getTimeoutSeconds()))
                .onErrorMap(e -> !(e instanceof UpstreamException), e -> {
                    log.error("跟踪服务调用失败: {}", e.getMessage());
                    if (e instanceof WebClientResponseException) {
                        WebClientResponseException response = (WebClientResponseException) e;
                        return new UpstreamException("Tracking service unavailable: HTTP "
                                + response.getRawStatusCode() + " from " + uri, e);
                    }
                    return new UpstreamException("Tracking service unavailable: " + e.getMessage(), e);
                });
    }

    VideoTrackingData parseVideoResult(String response) {
        JsonNode root = readTree(response);

        List<VideoTrackingData.FrameSummary> frames = new ArrayList<>();
        for (JsonNode frame : root.path("frame_detections")) {
            frames.add(VideoTrackingData.FrameSummary.builder()
                    .frameNumber(frame.path("frame_number").asInt())
                    .timestamp(frame.path("timestamp").asDouble())
                    .detectionCount(frame.path("detection_count").asInt())
                    .build());
        }

        // 轨迹ID在JSON中是字符串键，保持服务返回的顺序
        Map<Integer, List<SpermDetection>> tracks = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("tracks").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            int trackId;
            try {
                trackId = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                log.warn("忽略非数字轨迹ID: {}", entry.getKey());
                continue;
            }
            tracks.put(trackId, parseDetections(entry.getValue(), true, "track " + trackId));
        }

        return VideoTrackingData.builder()
                .frames(frames)
                .tracks(tracks)
                .modelVersion(root.path("model_version").asText(tracking.getModelVersion()))
                .build();
    }

    ImageDetectionData parseImageResult(String response) {
        JsonNode root = readTree(response);
        return ImageDetectionData.builder()
                .detections(parseDetections(root.path("detections"), false, "image"))
                .modelVersion(root.path("model_version").asText(tracking.getModelVersion()))
                .build();
    }

    /**
     * 坐标（轨迹点还包括时间戳）必须是数值，缺失时整个响应视为无效
     */
    private List<SpermDetection> parseDetections(JsonNode points, boolean timed, String source) {
        List<SpermDetection> detections = new ArrayList<>();
        int index = 0;
        for (JsonNode point : points) {
            detections.add(SpermDetection.builder()
                    .x(requireNumber(point, "x", source, index))
                    .y(requireNumber(point, "y", source, index))
                    .confidence(point.path("confidence").asDouble())
                    .frameNumber(point.path("frame_number").asInt())
                    .timestamp(timed
                            ? requireNumber(point, "timestamp", source, index)
                            : point.path("timestamp").asDouble())
                    .build());
            index++;
        }
        return detections;
    }

    private static double requireNumber(JsonNode point, String field, String source, int index) {
        JsonNode value = point.path(field);
        if (!value.isNumber()) {
            throw new UpstreamException(String.format(
                    "Tracking service returned malformed detection: %s point %d has no numeric '%s'",
                    source, index, field));
        }
        return value.asDouble();
    }

    private JsonNode readTree(String response) {
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Tracking service returned malformed JSON", e);
        }
    }
}
