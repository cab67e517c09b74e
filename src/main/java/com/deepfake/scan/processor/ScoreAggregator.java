package com.deepfake.scan.processor;

import com.deepfake.scan.exception.AggregationPreconditionException;
import com.deepfake.scan.exception.InvalidScoreException;
import com.deepfake.scan.model.AggregatedReport;
import com.deepfake.scan.model.MediaType;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

/**
 * 多帧伪造概率聚合
 */
public class ScoreAggregator implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double VIDEO_PERCENTILE = 90.0;

    // 峰值融合参数，未经标定，保留以兼容历史结果
    public static final double PEAK_BLEND_GAP = 10.0;
    public static final double PERCENTILE_WEIGHT = 0.7;
    public static final double PEAK_WEIGHT = 0.3;

    public static final double VARIANCE_PENALTY = 1000.0;

    public AggregatedReport aggregate(List<Double> probabilities, MediaType mediaType) {
        if (probabilities == null || probabilities.isEmpty()) {
            throw new AggregationPreconditionException("Cannot aggregate an empty probability sequence");
        }

        double[] probs = new double[probabilities.size()];
        for (int i = 0; i < probs.length; i++) {
            Double p = probabilities.get(i);
            if (p == null || !Double.isFinite(p) || p < 0.0 || p > 1.0) {
                throw new InvalidScoreException("Frame probability at index " + i + " is not in [0,1]: " + p);
            }
            probs[i] = p;
        }

        double videoScore = percentile(probs, VIDEO_PERCENTILE) * 100;
        double peakRisk = max(probs) * 100;
        double meanRisk = mean(probs) * 100;
        double ganFingerprint = videoScore;

        double temporalConsistency = 100.0;
        if (mediaType == MediaType.VIDEO && probs.length > 1) {
            temporalConsistency = clamp(100 - variance(probs) * VARIANCE_PENALTY);
        }

        double audioScore = mediaType == MediaType.AUDIO ? videoScore : 0.0;

        double certainty = 0;
        for (double p : probs) {
            certainty += Math.max(p, 1 - p);
        }
        double confidence = certainty / probs.length * 100;

        double riskScore = videoScore;
        if (peakRisk > videoScore + PEAK_BLEND_GAP) {
            riskScore = videoScore * PERCENTILE_WEIGHT + peakRisk * PEAK_WEIGHT;
        }

        return AggregatedReport.builder()
                .videoScore(round2(videoScore))
                .peakRisk(round2(peakRisk))
                .meanRisk(round2(meanRisk))
                .audioScore(round2(audioScore))
                .ganFingerprint(round2(ganFingerprint))
                .temporalConsistency(round2(temporalConsistency))
                .riskScore(round2(riskScore))
                .confidence(round2(confidence))
                .build();
    }

    /**
     * 线性插值百分位数（与 numpy 默认定义一致）
     */
    static double percentile(double[] values, double percentile) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    private static double max(double[] values) {
        double max = values[0];
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * 总体方差
     */
    static double variance(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.length;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    static double round2(double value) {
        return new BigDecimal(clamp(value)).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
