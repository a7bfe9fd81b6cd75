package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.MediaInfo;
import com.example.casa.dto.MotilityClass;
import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.SpermTrack;
import com.example.casa.dto.TrackKinematics;
import com.example.casa.dto.VideoTrackingData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试数据构造
 */
final class CasaTestData {

    static final double FRAME_INTERVAL = 1.0 / 30.0;

    private CasaTestData() {
    }

    /**
     * 标定系数为1（像素即微米）的默认参数
     */
    static CasaProperties properties() {
        CasaProperties properties = new CasaProperties();
        properties.getCalibration().setMicronsPerPixel(1.0);
        return properties;
    }

    static SpermDetection point(double x, double y, double timestamp) {
        return SpermDetection.builder()
                .x(x)
                .y(y)
                .confidence(0.9)
                .frameNumber((int) Math.round(timestamp / FRAME_INTERVAL))
                .timestamp(timestamp)
                .build();
    }

    /**
     * 沿x轴匀速运动的轨迹
     */
    static List<SpermDetection> straightTrack(int points, double stepPixels) {
        List<SpermDetection> track = new ArrayList<>();
        for (int i = 0; i < points; i++) {
            track.add(point(i * stepPixels, 0.0, i * FRAME_INTERVAL));
        }
        return track;
    }

    static MediaInfo media(int width, int height) {
        return MediaInfo.builder()
                .width(width)
                .height(height)
                .fps(30.0)
                .totalFrames(90)
                .duration(3.0)
                .format("mp4")
                .fileSize(1234L)
                .build();
    }

    /**
     * 一条快速直线轨迹、一条慢速轨迹和一条点数不足的轨迹
     */
    static VideoTrackingData videoData() {
        Map<Integer, List<SpermDetection>> tracks = new LinkedHashMap<>();
        tracks.put(1, straightTrack(30, 2.0));
        tracks.put(2, straightTrack(30, 0.05));
        tracks.put(3, straightTrack(2, 1.0));

        List<VideoTrackingData.FrameSummary> frames = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            frames.add(VideoTrackingData.FrameSummary.builder()
                    .frameNumber(i)
                    .timestamp(i * FRAME_INTERVAL)
                    .detectionCount(i < 2 ? 3 : 2)
                    .build());
        }
        return VideoTrackingData.builder()
                .frames(frames)
                .tracks(tracks)
                .modelVersion("test-model")
                .build();
    }

    static SpermTrack trackWith(int trackId, double vcl, double vsl, MotilityClass motilityClass) {
        TrackKinematics kinematics = TrackKinematics.builder()
                .vcl(vcl)
                .vsl(vsl)
                .vap(vsl)
                .lin(vcl > 0 ? vsl / vcl * 100.0 : 0.0)
                .str(100.0)
                .wob(vcl > 0 ? vsl / vcl * 100.0 : 0.0)
                .alh(1.0)
                .bcf(2.0)
                .motilityClass(motilityClass)
                .build();
        return SpermTrack.builder()
                .trackId(trackId)
                .detections(List.of())
                .kinematics(kinematics)
                .build();
    }

    static SpermTrack rejectedTrack(int trackId) {
        return SpermTrack.builder()
                .trackId(trackId)
                .detections(List.of())
                .rejectionReason("Track has 2 points, at least 3 required")
                .build();
    }
}
