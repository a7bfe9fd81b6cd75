package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.MotilityClass;
import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.TrackKinematics;
import com.example.casa.exception.InvalidTrackException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 单条轨迹的CASA运动学参数计算（无状态）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackKinematicsCalculator {

    private final CasaProperties properties;

    /**
     * 计算轨迹的八个运动学参数并分级
     *
     * @param detections 按时间排序的检测点
     * @return 运动学参数
     * @throws InvalidTrackException 点数不足、时间戳不严格递增或结果非有限值
     */
    public TrackKinematics calculate(List<SpermDetection> detections) {
        int minLength = properties.getKinematics().getMinTrackLength();
        int n = detections != null ? detections.size() : 0;
        if (n < minLength) {
            throw new InvalidTrackException(
                    String.format("Track has %d points, at least %d required", n, minLength));
        }

        // 像素坐标换算为微米
        double scale = properties.getCalibration().getMicronsPerPixel();
        double[] xs = new double[n];
        double[] ys = new double[n];
        double[] ts = new double[n];
        for (int i = 0; i < n; i++) {
            SpermDetection detection = detections.get(i);
            xs[i] = detection.getX() * scale;
            ys[i] = detection.getY() * scale;
            ts[i] = detection.getTimestamp();
            if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i]) || !Double.isFinite(ts[i])) {
                throw new InvalidTrackException("Non-finite coordinate or timestamp at point " + i);
            }
            if (i > 0 && ts[i] <= ts[i - 1]) {
                throw new InvalidTrackException(
                        String.format("Timestamps not strictly increasing at point %d (%.4f <= %.4f)", i, ts[i], ts[i - 1]));
            }
        }

        double totalTime = ts[n - 1] - ts[0];

        double vcl = pathLength(xs, ys) / totalTime;
        double vsl = Math.hypot(xs[n - 1] - xs[0], ys[n - 1] - ys[0]) / totalTime;

        double vap;
        if (n >= properties.getKinematics().getMinPointsForSmoothing()) {
            double[][] smoothed = smoothPath(xs, ys, properties.getKinematics().getSmoothingWindow());
            vap = pathLength(smoothed[0], smoothed[1]) / totalTime;
        } else {
            vap = vsl;
        }

        double lin = percentRatio(vsl, vcl);
        double str = percentRatio(vsl, vap);
        double wob = percentRatio(vap, vcl);
        double alh = lateralHeadAmplitude(xs, ys);
        double bcf = n >= properties.getKinematics().getMinPointsForBcf()
                ? beatCrossFrequency(xs, ys, totalTime)
                : 0.0;

        double[] values = {vcl, vsl, vap, lin, str, wob, alh, bcf};
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new InvalidTrackException("Degenerate track geometry produced a non-finite kinematic value");
            }
        }

        return TrackKinematics.builder()
                .vcl(vcl)
                .vsl(vsl)
                .vap(vap)
                .lin(lin)
                .str(str)
                .wob(wob)
                .alh(alh)
                .bcf(bcf)
                .motilityClass(classify(vcl, vsl))
                .build();
    }

    /**
     * 按参考阈值分级：VCL与VSL均达标为前向运动，VCL超过最小运动阈值为非前向运动，否则不动
     */
    public MotilityClass classify(double vcl, double vsl) {
        CasaProperties.Motility motility = properties.getMotility();
        if (vcl >= motility.getVclProgressive() && vsl >= motility.getVslProgressive()) {
            return MotilityClass.PROGRESSIVE;
        }
        if (vcl > motility.getVclMinimal()) {
            return MotilityClass.NON_PROGRESSIVE;
        }
        return MotilityClass.IMMOTILE;
    }

    static double pathLength(double[] xs, double[] ys) {
        double length = 0.0;
        for (int i = 1; i < xs.length; i++) {
            length += Math.hypot(xs[i] - xs[i - 1], ys[i] - ys[i - 1]);
        }
        return length;
    }

    /**
     * 中心滑动平均。窗口在两端对称收缩，首尾点保持不变，
     * 因此平滑路径长度介于首尾直线距离与原路径长度之间
     */
    static double[][] smoothPath(double[] xs, double[] ys, int window) {
        int n = xs.length;
        int half = window / 2;
        double[] sx = new double[n];
        double[] sy = new double[n];
        for (int i = 0; i < n; i++) {
            int h = Math.min(half, Math.min(i, n - 1 - i));
            double sumX = 0.0;
            double sumY = 0.0;
            for (int k = i - h; k <= i + h; k++) {
                sumX += xs[k];
                sumY += ys[k];
            }
            int count = 2 * h + 1;
            sx[i] = sumX / count;
            sy[i] = sumY / count;
        }
        return new double[][]{sx, sy};
    }

    static double percentRatio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator * 100.0 : 0.0;
    }

    /**
     * ALH：各点到最小二乘拟合直线的平均垂直距离
     */
    static double lateralHeadAmplitude(double[] xs, double[] ys) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < xs.length; i++) {
            regression.addData(xs[i], ys[i]);
        }

        double slope = regression.getSlope();
        if (Double.isNaN(slope)) {
            // x无方差，拟合线为竖直线 x = mean(x)
            double meanX = 0.0;
            for (double x : xs) {
                meanX += x;
            }
            meanX /= xs.length;
            double sum = 0.0;
            for (double x : xs) {
                sum += Math.abs(x - meanX);
            }
            return sum / xs.length;
        }

        double intercept = regression.getIntercept();
        double norm = Math.sqrt(slope * slope + 1.0);
        double sum = 0.0;
        for (int i = 0; i < xs.length; i++) {
            sum += Math.abs(slope * xs[i] - ys[i] + intercept) / norm;
        }
        return sum / xs.length;
    }

    /**
     * BCF：侧向位移（相对首点，投影到总位移方向的垂直轴）过零次数的一半除以总时长
     */
    static double beatCrossFrequency(double[] xs, double[] ys, double totalTime) {
        int n = xs.length;
        double dx = xs[n - 1] - xs[0];
        double dy = ys[n - 1] - ys[0];
        double norm = Math.hypot(dx, dy);
        if (norm == 0.0 || totalTime <= 0.0) {
            return 0.0;
        }

        double perpX = -dy / norm;
        double perpY = dx / norm;

        int crossings = 0;
        double previous = 0.0;
        for (int i = 0; i < n; i++) {
            double lateral = (xs[i] - xs[0]) * perpX + (ys[i] - ys[0]) * perpY;
            if (i > 0 && previous * lateral < 0) {
                crossings++;
            }
            previous = lateral;
        }
        return (crossings / 2.0) / totalTime;
    }
}
