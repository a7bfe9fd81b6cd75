package com.example.casa.service;

import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.SpermTrack;
import com.example.casa.exception.InvalidTrackException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 将跟踪服务返回的原始点序列转换为轨迹并附加运动学参数
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackAnalyzer {

    private final TrackKinematicsCalculator calculator;

    /**
     * 并行计算所有轨迹，结果按轨迹ID排序
     */
    public Mono<List<SpermTrack>> analyzeAll(Map<Integer, List<SpermDetection>> rawTracks) {
        if (rawTracks == null || rawTracks.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(rawTracks.entrySet())
                .parallel()
                .runOn(Schedulers.parallel())
                .map(entry -> analyze(entry.getKey(), entry.getValue()))
                .sequential()
                .collectSortedList(Comparator.comparingInt(SpermTrack::getTrackId));
    }

    /**
     * 单条轨迹计算失败只影响该轨迹：保留轨迹并记录排除原因
     */
    public SpermTrack analyze(int trackId, List<SpermDetection> points) {
        List<SpermDetection> detections = points != null ? List.copyOf(points) : List.of();
        SpermTrack.SpermTrackBuilder builder = SpermTrack.builder()
                .trackId(trackId)
                .detections(detections);

        if (!detections.isEmpty()) {
            SpermDetection first = detections.get(0);
            SpermDetection last = detections.get(detections.size() - 1);
            builder.startFrame(first.getFrameNumber())
                    .endFrame(last.getFrameNumber())
                    .duration(last.getTimestamp() - first.getTimestamp());
        }

        try {
            return builder.kinematics(calculator.calculate(detections)).build();
        } catch (InvalidTrackException e) {
            log.debug("轨迹 #{} 被排除: {}", trackId, e.getMessage());
            return builder.rejectionReason(e.getMessage()).build();
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.warn("轨迹 #{} 运动学计算异常", trackId, e);
            return builder.rejectionReason("Kinematics computation failed: " + e.getMessage()).build();
        }
    }
}
