package com.deepfake.scan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 单次扫描的处理结果（写入Doris）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private String hash;

    private MediaType mediaType;

    /**
     * 实际送入分类器的帧数
     */
    private Integer framesAnalyzed;

    /**
     * 检测到人脸的帧数，其余帧使用整图
     */
    private Integer facesDetected;

    private ScanResponse response;

    /**
     * 处理完成时间戳（毫秒）
     */
    private Long processedAt;
}
