package com.deepfake.scan.model;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * 多帧得分聚合后的风险报告，所有字段范围 [0,100]，保留两位小数
 */
@Value
@Builder
public class AggregatedReport implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 帧伪造概率的P90
     */
    double videoScore;

    double peakRisk;

    double meanRisk;

    /**
     * 仅AUDIO类型时等于videoScore，其余为0
     */
    double audioScore;

    double ganFingerprint;

    /**
     * 时序一致性，单帧或非视频时为100
     */
    double temporalConsistency;

    double riskScore;

    double confidence;
}
