package com.deepfake.scan.serialization;

import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.model.HealthStatus;
import com.deepfake.scan.model.MediaType;
import com.deepfake.scan.model.ScanFailure;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.model.ScanResponse;
import com.deepfake.scan.model.ScanResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanJsonCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static ScanResponse response() {
        return ScanResponse.builder()
                .videoScore(58.0)
                .peakRisk(90.0)
                .meanRisk(26.0)
                .audioScore(0.0)
                .ganFingerprint(58.0)
                .temporalConsistency(0.0)
                .riskScore(67.6)
                .confidence(90.0)
                .modelVersion("v2")
                .inferenceTime(1234)
                .build();
    }

    @Test
    void parsesCamelCaseRequestIgnoringUnknownFields() {
        ScanRequest request = ScanJsonCodec.parseRequest("{\"hash\":\"abc\",\"mediaType\":\"VIDEO\","
                + "\"modelVersion\":\"v2\",\"extractedFrames\":[\"/tmp/f1.jpg\",\"/tmp/f2.jpg\"],"
                + "\"metadata\":{\"duration\":3.5},\"uploadedBy\":\"someone\"}");

        assertEquals("abc", request.getHash());
        assertEquals("VIDEO", request.getMediaType());
        assertEquals(Arrays.asList("/tmp/f1.jpg", "/tmp/f2.jpg"), request.getExtractedFrames());
        assertEquals(3.5, request.getMetadata().get("duration"));
    }

    @Test
    void rejectsMalformedBodies() {
        assertEquals(400, assertThrows(InvalidInputException.class,
                () -> ScanJsonCodec.parseRequest("not json")).getStatus());
        assertThrows(InvalidInputException.class, () -> ScanJsonCodec.parseRequest(""));
        assertThrows(InvalidInputException.class, () -> ScanJsonCodec.parseRequest(null));
        assertThrows(InvalidInputException.class, () -> ScanJsonCodec.parseRequest("null"));
        assertThrows(InvalidInputException.class,
                () -> ScanJsonCodec.parseRequest("{\"extractedFrames\":\"not-a-list\"}"));
    }

    @Test
    void responseUsesSnakeCase() throws Exception {
        JsonNode json = mapper.readTree(ScanJsonCodec.toJson(response()));

        assertEquals(58.0, json.get("video_score").asDouble());
        assertEquals(67.6, json.get("risk_score").asDouble());
        assertEquals(0.0, json.get("temporal_consistency").asDouble());
        assertEquals("v2", json.get("model_version").asText());
        assertEquals(1234, json.get("inference_time").asLong());
        assertEquals(10, json.size());
    }

    @Test
    void reportRowIsFlatSingleLine() throws Exception {
        ScanResult result = ScanResult.builder()
                .hash("abc")
                .mediaType(MediaType.VIDEO)
                .framesAnalyzed(5)
                .facesDetected(4)
                .response(response())
                .processedAt(1700000000000L)
                .build();

        String row = ScanJsonCodec.toReportRow(result);
        JsonNode json = mapper.readTree(row);

        assertFalse(row.contains("\n"));
        assertEquals("abc", json.get("hash").asText());
        assertEquals("VIDEO", json.get("media_type").asText());
        assertEquals(5, json.get("frames_analyzed").asInt());
        assertEquals(4, json.get("faces_detected").asInt());
        assertEquals(67.6, json.get("risk_score").asDouble());
        assertEquals("v2", json.get("model_version").asText());
        assertTrue(json.get("processed_at").asText().matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"));
    }

    @Test
    void failureRowAndEnvelope() throws Exception {
        ScanFailure failure = ScanFailure.builder()
                .hash("abc")
                .status(503)
                .error("Service Unavailable")
                .message("Model is not loaded")
                .timestamp(1700000000000L)
                .build();

        JsonNode row = mapper.readTree(ScanJsonCodec.toFailureRow(failure));
        assertEquals(503, row.get("status").asInt());
        assertEquals("Service Unavailable", row.get("error").asText());
        assertTrue(row.has("failed_at"));

        JsonNode envelope = mapper.readTree(ScanJsonCodec.toErrorEnvelope(failure));
        assertEquals(2, envelope.size());
        assertEquals("Service Unavailable", envelope.get("error").asText());
        assertEquals("Model is not loaded", envelope.get("message").asText());
    }

    @Test
    void healthUsesSnakeCase() throws Exception {
        HealthStatus health = HealthStatus.builder()
                .status(HealthStatus.HEALTHY)
                .service("deepfake-detection-ml-service")
                .version("2.0.0")
                .model("efficientnet_b0_ffpp_c23")
                .modelStatus("loaded")
                .detector("OpenCV DNN")
                .timestamp("2024-01-01T00:00:00Z")
                .build();

        JsonNode json = mapper.readTree(ScanJsonCodec.toJson(health));

        assertEquals("healthy", json.get("status").asText());
        assertEquals("loaded", json.get("model_status").asText());
        assertFalse(json.has("healthy"));
    }

    @Test
    void requestSurvivesProducerSerialization() {
        ScanRequest original = ScanRequest.builder()
                .hash("abc")
                .mediaType("IMAGE")
                .extractedFrames(Arrays.asList("/tmp/a.jpg"))
                .build();

        ScanRequest parsed = ScanJsonCodec.parseRequest(ScanJsonCodec.toJson(original));

        assertEquals(original, parsed);
    }
}
