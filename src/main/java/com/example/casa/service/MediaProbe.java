package com.example.casa.service;

import com.example.casa.dto.AnalysisType;
import com.example.casa.dto.MediaInfo;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 读取样本媒体属性（尺寸、帧率、帧数）
 */
public interface MediaProbe {

    /**
     * @throws com.example.casa.exception.UpstreamException 媒体无法读取
     */
    Mono<MediaInfo> probe(Path file, AnalysisType type);
}
