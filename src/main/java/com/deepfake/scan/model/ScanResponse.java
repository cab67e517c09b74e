package com.deepfake.scan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 推理响应，字段名为 snake_case 以兼容下游调用方
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScanResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    private double videoScore;
    private double peakRisk;
    private double meanRisk;
    private double audioScore;
    private double ganFingerprint;
    private double temporalConsistency;
    private double riskScore;
    private double confidence;
    private String modelVersion;

    /**
     * 推理耗时（毫秒）
     */
    private long inferenceTime;

    public static ScanResponse of(AggregatedReport report, String modelVersion, long inferenceTime) {
        return ScanResponse.builder()
                .videoScore(report.getVideoScore())
                .peakRisk(report.getPeakRisk())
                .meanRisk(report.getMeanRisk())
                .audioScore(report.getAudioScore())
                .ganFingerprint(report.getGanFingerprint())
                .temporalConsistency(report.getTemporalConsistency())
                .riskScore(report.getRiskScore())
                .confidence(report.getConfidence())
                .modelVersion(modelVersion)
                .inferenceTime(inferenceTime)
                .build();
    }
}
