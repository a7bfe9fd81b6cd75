package com.example.casa.service.impl;

import com.example.casa.dto.AnalysisType;
import com.example.casa.dto.MediaInfo;
import com.example.casa.exception.UpstreamException;
import com.example.casa.service.MediaProbe;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 视频用 FFmpegFrameGrabber 读取属性，图像用 ImageIO
 */
@Slf4j
@Service
public class FfmpegMediaProbe implements MediaProbe {

    @Override
    public Mono<MediaInfo> probe(Path file, AnalysisType type) {
        return Mono.fromCallable(() -> {
                    if (!Files.isRegularFile(file)) {
                        throw new UpstreamException("Could not read media: file not found " + file.getFileName());
                    }
                    return type == AnalysisType.IMAGE ? probeImage(file) : probeVideo(file);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof UpstreamException),
                        e -> new UpstreamException("Could not read media: " + e.getMessage(), e));
    }

    private MediaInfo probeVideo(Path file) throws IOException {
        try (FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(file.toFile())) {
            log.debug("启动FFmpegFrameGrabber: {}", file);
            grabber.start();

            double fps = grabber.getFrameRate();
            long totalFrames = grabber.getLengthInFrames();
            double duration = grabber.getLengthInTime() / 1_000_000.0;
            if (duration <= 0 && fps > 0) {
                duration = totalFrames / fps;
            }
            int width = grabber.getImageWidth();
            int height = grabber.getImageHeight();
            if (width <= 0 || height <= 0) {
                throw new UpstreamException("Could not read media: no video stream in " + file.getFileName());
            }

            MediaInfo info = MediaInfo.builder()
                    .width(width)
                    .height(height)
                    .fps(fps)
                    .totalFrames(totalFrames)
                    .duration(duration)
                    .format(grabber.getFormat())
                    .fileSize(Files.size(file))
                    .build();
            grabber.stop();

            log.info("视频属性: {}x{}, {} fps, {} 帧, {}s", width, height, String.format("%.2f", fps),
                    totalFrames, String.format("%.2f", duration));
            return info;
        }
    }

    private MediaInfo probeImage(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new UpstreamException("Could not read media: unsupported image format " + file.getFileName());
        }
        String name = file.getFileName().toString();
        String format = name.contains(".") ? name.substring(name.lastIndexOf('.') + 1).toLowerCase() : "";
        log.info("图像属性: {}x{}", image.getWidth(), image.getHeight());
        return MediaInfo.builder()
                .width(image.getWidth())
                .height(image.getHeight())
                .fps(0.0)
                .totalFrames(1)
                .duration(0.0)
                .format(format)
                .fileSize(Files.size(file))
                .build();
    }
}
