package com.example.casa.service;

import com.example.casa.dto.CasaMetrics;
import com.example.casa.dto.ImageMetrics;
import com.example.casa.dto.MediaInfo;
import com.example.casa.dto.ParameterSummary;
import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.VideoMetrics;
import com.example.casa.dto.VideoTrackingData;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 视频/图像样本特有指标
 */
@Service
public class SampleMetricsCalculator {

    /** 密度网格的边数（边数-1 个区间） */
    static final int GRID_EDGES = 50;

    /** 高密度区域阈值分位数 */
    static final double REGION_PERCENTILE = 75.0;

    /**
     * 视频逐帧计数、密度（个/百万像素）及计数时间序列
     */
    public VideoMetrics videoMetrics(MediaInfo media, List<VideoTrackingData.FrameSummary> frames) {
        List<VideoTrackingData.FrameSummary> summaries = frames != null ? frames : List.of();
        List<Integer> counts = summaries.stream()
                .map(VideoTrackingData.FrameSummary::getDetectionCount)
                .collect(Collectors.toList());
        double pixels = (double) media.getWidth() * media.getHeight();
        List<Double> densities = counts.stream()
                .map(count -> perMegapixel(count, pixels))
                .collect(Collectors.toList());
        List<VideoMetrics.CountPoint> countOverTime = summaries.stream()
                .map(frame -> VideoMetrics.CountPoint.builder()
                        .time(frame.getTimestamp())
                        .count(frame.getDetectionCount())
                        .build())
                .collect(Collectors.toList());

        return VideoMetrics.builder()
                .totalFrames(media.getTotalFrames())
                .fps(media.getFps())
                .duration(media.getDuration())
                .width(media.getWidth())
                .height(media.getHeight())
                .frameCounts(counts)
                .frameDensities(densities)
                .countOverTime(countOverTime)
                .build();
    }

    /**
     * 静态图像无运动信息：只有计数与密度，全部视为不动
     */
    public CasaMetrics imagePopulation(List<SpermDetection> detections, MediaInfo media) {
        int count = detections != null ? detections.size() : 0;
        double pixels = (double) media.getWidth() * media.getHeight();
        return CasaMetrics.builder()
                .totalCount(count)
                .concentration(perMegapixel(count, pixels))
                .progressiveMotility(0.0)
                .nonProgressiveMotility(0.0)
                .totalMotility(0.0)
                .immotile(100.0)
                .vcl(ParameterSummary.EMPTY)
                .vsl(ParameterSummary.EMPTY)
                .vap(ParameterSummary.EMPTY)
                .lin(ParameterSummary.EMPTY)
                .str(ParameterSummary.EMPTY)
                .wob(ParameterSummary.EMPTY)
                .alh(ParameterSummary.EMPTY)
                .bcf(ParameterSummary.EMPTY)
                .build();
    }

    public ImageMetrics imageMetrics(List<SpermDetection> detections, MediaInfo media) {
        return ImageMetrics.builder()
                .width(media.getWidth())
                .height(media.getHeight())
                .detectionRegions(densityRegions(detections, media.getWidth(), media.getHeight()))
                .build();
    }

    /**
     * 在均匀网格上统计检测数，返回计数高于75分位数的格子。
     * 落在图像范围外的检测不计入，右/下边界计入最后一格
     */
    static List<ImageMetrics.DensityRegion> densityRegions(List<SpermDetection> detections, int width, int height) {
        if (detections == null || detections.isEmpty() || width <= 0 || height <= 0) {
            return List.of();
        }

        int bins = GRID_EDGES - 1;
        double cellWidth = (double) width / bins;
        double cellHeight = (double) height / bins;
        double[][] grid = new double[bins][bins];

        for (SpermDetection detection : detections) {
            int i = binIndex(detection.getX(), width, cellWidth, bins);
            int j = binIndex(detection.getY(), height, cellHeight, bins);
            if (i >= 0 && j >= 0) {
                grid[i][j]++;
            }
        }

        double[] flat = new double[bins * bins];
        for (int i = 0; i < bins; i++) {
            System.arraycopy(grid[i], 0, flat, i * bins, bins);
        }
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(flat, REGION_PERCENTILE);

        List<ImageMetrics.DensityRegion> regions = new ArrayList<>();
        for (int i = 0; i < bins; i++) {
            for (int j = 0; j < bins; j++) {
                if (grid[i][j] > threshold) {
                    regions.add(ImageMetrics.DensityRegion.builder()
                            .minX(i * cellWidth)
                            .maxX((i + 1) * cellWidth)
                            .minY(j * cellHeight)
                            .maxY((j + 1) * cellHeight)
                            .density(grid[i][j])
                            .build());
                }
            }
        }
        return regions;
    }

    private static int binIndex(double value, double extent, double cell, int bins) {
        if (!Double.isFinite(value) || value < 0 || value > extent) {
            return -1;
        }
        return Math.min((int) (value / cell), bins - 1);
    }

    private static double perMegapixel(int count, double pixels) {
        return pixels > 0 ? count / pixels * 1_000_000.0 : 0.0;
    }
}
