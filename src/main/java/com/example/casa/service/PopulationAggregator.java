package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.CasaMetrics;
import com.example.casa.dto.KinematicParameter;
import com.example.casa.dto.MotilityClass;
import com.example.casa.dto.ParameterSummary;
import com.example.casa.dto.SpermTrack;
import com.example.casa.dto.TrackKinematics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 群体级CASA指标汇总（无状态）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopulationAggregator {

    private final CasaProperties properties;

    /**
     * 汇总已计算运动学参数的轨迹，未计算的轨迹不参与统计
     */
    public CasaMetrics aggregate(Collection<SpermTrack> tracks) {
        List<TrackKinematics> valid = tracks.stream()
                .filter(SpermTrack::hasKinematics)
                .map(SpermTrack::getKinematics)
                .collect(Collectors.toList());

        if (valid.isEmpty()) {
            return emptyPopulation();
        }

        Map<MotilityClass, Integer> counts = new EnumMap<>(MotilityClass.class);
        for (TrackKinematics kinematics : valid) {
            counts.merge(kinematics.getMotilityClass(), 1, Integer::sum);
        }

        int total = valid.size();
        int progressive = counts.getOrDefault(MotilityClass.PROGRESSIVE, 0);
        int nonProgressive = counts.getOrDefault(MotilityClass.NON_PROGRESSIVE, 0);
        int immotile = counts.getOrDefault(MotilityClass.IMMOTILE, 0);

        Map<KinematicParameter, ParameterSummary> summaries = new EnumMap<>(KinematicParameter.class);
        for (KinematicParameter parameter : KinematicParameter.values()) {
            double[] values = valid.stream()
                    .mapToDouble(kinematics -> parameter.valueOf(kinematics))
                    .filter(Double::isFinite)
                    .toArray();
            summaries.put(parameter, summarize(values));
        }

        log.debug("群体汇总: 有效轨迹 {}, PR {}, NP {}, IM {}", total, progressive, nonProgressive, immotile);

        return CasaMetrics.builder()
                .totalCount(total)
                .concentration(total * properties.getCalibration().getConcentrationPerTrack())
                .progressiveMotility(percent(progressive, total))
                .nonProgressiveMotility(percent(nonProgressive, total))
                .totalMotility(percent(progressive + nonProgressive, total))
                .immotile(percent(immotile, total))
                .vcl(summaries.get(KinematicParameter.VCL))
                .vsl(summaries.get(KinematicParameter.VSL))
                .vap(summaries.get(KinematicParameter.VAP))
                .lin(summaries.get(KinematicParameter.LIN))
                .str(summaries.get(KinematicParameter.STR))
                .wob(summaries.get(KinematicParameter.WOB))
                .alh(summaries.get(KinematicParameter.ALH))
                .bcf(summaries.get(KinematicParameter.BCF))
                .build();
    }

    /**
     * 空群体：不动100%，其余为0
     */
    public static CasaMetrics emptyPopulation() {
        return CasaMetrics.builder()
                .totalCount(0)
                .concentration(0.0)
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

    static ParameterSummary summarize(double[] values) {
        if (values.length == 0) {
            return ParameterSummary.EMPTY;
        }
        return ParameterSummary.builder()
                .mean(new Mean().evaluate(values))
                .std(new StandardDeviation(false).evaluate(values))
                .sampleCount(values.length)
                .build();
    }

    private static double percent(int count, int total) {
        return total > 0 ? (double) count / total * 100.0 : 0.0;
    }
}
