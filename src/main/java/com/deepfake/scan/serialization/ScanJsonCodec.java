package com.deepfake.scan.serialization;

import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.model.HealthStatus;
import com.deepfake.scan.model.ScanFailure;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.model.ScanResponse;
import com.deepfake.scan.model.ScanResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * 扫描消息的JSON编解码
 *
 * 请求为 camelCase，响应与健康状态为 snake_case，写入Doris的行为扁平的 snake_case 对象
 */
public final class ScanJsonCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final DateTimeFormatter DORIS_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private ScanJsonCodec() {
    }

    public static ScanRequest parseRequest(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new InvalidInputException("Request body is required");
        }
        try {
            ScanRequest request = objectMapper.readValue(json, ScanRequest.class);
            if (request == null) {
                throw new InvalidInputException("Request body is required");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Request body must be JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(ScanRequest request) {
        return write(request);
    }

    public static String toJson(ScanResponse response) {
        return write(response);
    }

    public static String toJson(HealthStatus health) {
        return write(health);
    }

    /**
     * 错误信封 {"error": ..., "message": ...}
     */
    public static String toErrorEnvelope(ScanFailure failure) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", failure.getError());
        node.put("message", failure.getMessage());
        return write(node);
    }

    /**
     * 转换ScanResult为Doris行（单行JSON）
     */
    public static String toReportRow(ScanResult result) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("hash", result.getHash());
        row.put("media_type", result.getMediaType() != null ? result.getMediaType().name() : null);
        row.put("frames_analyzed", result.getFramesAnalyzed());
        row.put("faces_detected", result.getFacesDetected());

        ScanResponse response = result.getResponse();
        if (response != null) {
            // 与HTTP响应同名的字段直接平铺
            row.setAll((ObjectNode) objectMapper.valueToTree(response));
        }
        row.put("processed_at", formatTime(result.getProcessedAt()));
        return write(row);
    }

    /**
     * 转换ScanFailure为Doris行（单行JSON）
     */
    public static String toFailureRow(ScanFailure failure) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("hash", failure.getHash());
        row.put("status", failure.getStatus());
        row.put("error", failure.getError());
        row.put("message", failure.getMessage());
        row.put("failed_at", formatTime(failure.getTimestamp()));
        return write(row);
    }

    private static String formatTime(Long epochMillis) {
        return epochMillis == null ? null : DORIS_DATETIME.format(Instant.ofEpochMilli(epochMillis));
    }

    private static String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
