package com.deepfake.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * 扫描请求（Kafka消息体）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanRequest implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 媒体文件SHA-256
     */
    private String hash;

    /**
     * IMAGE / VIDEO / AUDIO
     */
    private String mediaType;

    private String modelVersion;

    /**
     * 已抽取的帧文件路径，按时间顺序
     */
    private List<String> extractedFrames;

    /**
     * 已抽取的音频路径（当前模型不使用）
     */
    private String extractedAudio;

    private Map<String, Object> metadata;
}
