package com.example.casa.service;

import com.example.casa.dto.ImageDetectionData;
import com.example.casa.dto.VideoTrackingData;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 检测/跟踪模型服务
 */
public interface SpermTrackingClient {

    /**
     * 视频逐帧检测并关联为轨迹
     */
    Mono<VideoTrackingData> trackVideo(Path video);

    /**
     * 静态图像检测，无轨迹身份
     */
    Mono<ImageDetectionData> detectImage(Path image);
}
