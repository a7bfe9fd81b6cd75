package com.example.casa.service;

import com.example.casa.dto.ImageDetectionData;
import com.example.casa.dto.VideoTrackingData;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 可控的跟踪服务：可阻塞直到放行，或返回错误
 */
class FakeTrackingClient implements SpermTrackingClient {

    volatile Supplier<Mono<VideoTrackingData>> video = () -> Mono.just(CasaTestData.videoData());

    volatile Supplier<Mono<ImageDetectionData>> image = () -> Mono.error(new IllegalStateException("no image data"));

    /** 非空时调用在进入后等待放行 */
    volatile CountDownLatch gate;

    final CountDownLatch entered = new CountDownLatch(1);

    @Override
    public Mono<VideoTrackingData> trackVideo(Path video) {
        return Mono.defer(() -> {
            passGate();
            return this.video.get();
        });
    }

    @Override
    public Mono<ImageDetectionData> detectImage(Path image) {
        return Mono.defer(() -> {
            passGate();
            return this.image.get();
        });
    }

    private void passGate() {
        entered.countDown();
        CountDownLatch current = gate;
        if (current == null) {
            return;
        }
        try {
            if (!current.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
