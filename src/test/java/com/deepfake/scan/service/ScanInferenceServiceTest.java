package com.deepfake.scan.service;

import com.deepfake.scan.classifier.ImageClassifier;
import com.deepfake.scan.config.ScanJobConfig;
import com.deepfake.scan.detector.FaceDetector;
import com.deepfake.scan.detector.FaceDetectorBackend;
import com.deepfake.scan.detector.FaceDetectorProvider;
import com.deepfake.scan.exception.ClassifierUnavailableException;
import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.exception.ScanException;
import com.deepfake.scan.exception.UnsupportedMediaTypeException;
import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.image.StubFrameImage;
import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.Detection;
import com.deepfake.scan.model.HealthStatus;
import com.deepfake.scan.model.LabelScore;
import com.deepfake.scan.model.MediaType;
import com.deepfake.scan.model.ScanRequest;
import com.deepfake.scan.model.ScanResult;
import com.deepfake.scan.processor.FaceCropGeometry;
import com.deepfake.scan.processor.FaceLocalizer;
import com.deepfake.scan.processor.FakeProbabilityExtractor;
import com.deepfake.scan.processor.ScoreAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScanInferenceServiceTest {

    @Mock
    private ImageClassifier classifier;

    @Mock
    private FaceDetector detector;

    private final List<StubFrameImage> loadedFrames = new ArrayList<>();
    private final List<List<FrameImage>> classifiedBatches = new ArrayList<>();

    private ScanJobConfig config;
    private ScanInferenceService service;

    @BeforeEach
    void setUp() {
        config = new ScanJobConfig();
        config.setFaceDetectionEnabled(false);

        when(detector.getBackend()).thenReturn(FaceDetectorBackend.DNN);
        when(detector.getConfidenceThreshold()).thenReturn(0.3f);
        when(detector.detect(any())).thenReturn(Collections.emptyList());

        when(classifier.isReady()).thenReturn(true);
        when(classifier.getModelName()).thenReturn("test-model");
        // 第一帧伪造概率0.9，其余0.1
        when(classifier.classify(anyList())).thenAnswer(invocation -> {
            List<FrameImage> argument = invocation.getArgument(0);
            List<FrameImage> batch = new ArrayList<>(argument);
            classifiedBatches.add(batch);
            List<List<LabelScore>> results = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                double fake = i == 0 ? 0.9 : 0.1;
                results.add(Arrays.asList(new LabelScore("Real", 1 - fake), new LabelScore("Fake", fake)));
            }
            return results;
        });

        FaceLocalizer localizer = new FaceLocalizer(() -> detector, new FaceCropGeometry());
        service = new ScanInferenceService(config, this::loadFrame, localizer, classifier,
                new FakeProbabilityExtractor(), new ScoreAggregator(), new FaceDetectorProvider(config));
    }

    private FrameImage loadFrame(String path) {
        if (path.startsWith("missing")) {
            throw new InvalidInputException("Image file not found: " + path);
        }
        StubFrameImage image = new StubFrameImage(path, 100, 100);
        loadedFrames.add(image);
        return image;
    }

    private static List<String> paths(int count) {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            paths.add(String.format("frame_%04d.jpg", i));
        }
        return paths;
    }

    private static ScanRequest request(String mediaType, List<String> frames) {
        return ScanRequest.builder()
                .hash("abc123")
                .mediaType(mediaType)
                .extractedFrames(frames)
                .build();
    }

    @Test
    void videoScanAggregatesAllFrames() {
        ScanResult result = service.infer(request("VIDEO", paths(5)));

        assertEquals("abc123", result.getHash());
        assertEquals(MediaType.VIDEO, result.getMediaType());
        assertEquals(5, result.getFramesAnalyzed());
        assertEquals(0, result.getFacesDetected());
        assertEquals(58.0, result.getResponse().getVideoScore());
        assertEquals(90.0, result.getResponse().getPeakRisk());
        assertEquals(67.6, result.getResponse().getRiskScore());
        assertEquals("v2", result.getResponse().getModelVersion());
        assertTrue(result.getResponse().getInferenceTime() >= 0);
        assertEquals(1, classifiedBatches.size());
    }

    @Test
    void videoIsSampledToMaxFrames() {
        ScanResult result = service.infer(request("video", paths(100)));

        assertEquals(30, result.getFramesAnalyzed());
        assertEquals(30, classifiedBatches.get(0).size());
        assertEquals("frame_0003.jpg", ((StubFrameImage) classifiedBatches.get(0).get(1)).getName());
    }

    @Test
    void imageScanUsesFirstFrameOnly() {
        ScanResult result = service.infer(request("IMAGE", paths(3)));

        assertEquals(1, result.getFramesAnalyzed());
        assertEquals(90.0, result.getResponse().getVideoScore());
        assertEquals(100.0, result.getResponse().getTemporalConsistency());
        assertEquals(1, loadedFrames.size());
    }

    @Test
    void requestedModelVersionIsEchoed() {
        ScanRequest request = request("IMAGE", paths(1));
        request.setModelVersion("v3");

        assertEquals("v3", service.infer(request).getResponse().getModelVersion());
    }

    @Test
    void detectedFacesAreCroppedBeforeClassification() {
        when(detector.detect(any())).thenReturn(Collections.singletonList(
                new Detection(new BoundingBox(40, 40, 20, 20), 0.9f)));

        ScanResult result = service.infer(request("VIDEO", paths(2)));

        assertEquals(2, result.getFacesDetected());
        StubFrameImage cropped = (StubFrameImage) classifiedBatches.get(0).get(0);
        assertEquals(26, cropped.getWidth());
        assertEquals(37, cropped.getCropRegion().getX());
        assertTrue(cropped.isReleased());
    }

    @Test
    void unreadableFramesAreSkipped() {
        List<String> frames = new ArrayList<>(paths(4));
        frames.add(1, "missing_frame.jpg");

        ScanResult result = service.infer(request("VIDEO", frames));

        assertEquals(4, result.getFramesAnalyzed());
    }

    @Test
    void allFramesUnreadableIsInvalidInput() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.infer(request("VIDEO", Arrays.asList("missing_a.jpg", "missing_b.jpg"))));

        assertEquals(400, e.getStatus());
        assertEquals("No valid frames processed", e.getMessage());
        verify(classifier, never()).classify(anyList());
    }

    @Test
    void framesAreReleasedAfterScan() {
        service.infer(request("VIDEO", paths(5)));

        assertEquals(5, loadedFrames.size());
        for (StubFrameImage frame : loadedFrames) {
            assertTrue(frame.isReleased(), frame.getName());
        }
    }

    @Test
    void framesAreReleasedWhenClassifierFails() {
        doThrow(new IllegalStateException("inference crashed")).when(classifier).classify(anyList());

        assertThrows(IllegalStateException.class, () -> service.infer(request("VIDEO", paths(3))));
        for (StubFrameImage frame : loadedFrames) {
            assertTrue(frame.isReleased(), frame.getName());
        }
    }

    @Test
    void audioIsRejectedAsUnsupported() {
        UnsupportedMediaTypeException e = assertThrows(UnsupportedMediaTypeException.class,
                () -> service.infer(request("AUDIO", paths(1))));

        assertEquals(400, e.getStatus());
        assertEquals("Unsupported media type", e.getError());
    }

    @Test
    void invalidRequestsAreRejected() {
        assertStatus(400, () -> service.infer(null));
        assertStatus(400, () -> service.infer(request("GIF", paths(1))));
        assertStatus(400, () -> service.infer(request(null, paths(1))));
        assertStatus(400, () -> service.infer(request("VIDEO", Collections.emptyList())));
        assertStatus(400, () -> service.infer(request("IMAGE", null)));
    }

    @Test
    void classifierNotReadyIsServiceUnavailable() {
        when(classifier.isReady()).thenReturn(false);

        ClassifierUnavailableException e = assertThrows(ClassifierUnavailableException.class,
                () -> service.infer(request("VIDEO", paths(3))));

        assertEquals(503, e.getStatus());
        assertTrue(loadedFrames.isEmpty());
    }

    @Test
    void classifierNotReadyTakesPrecedenceOverMediaTypeErrors() {
        when(classifier.isReady()).thenReturn(false);

        assertStatus(503, () -> service.infer(request("AUDIO", paths(1))));
        assertStatus(503, () -> service.infer(request("GIF", paths(1))));
        assertTrue(loadedFrames.isEmpty());
    }

    @Test
    void outOfRangeClassifierScoreIsInferenceFailure() {
        doReturn(Collections.singletonList(Arrays.asList(new LabelScore("Real", -0.7), new LabelScore("Fake", 1.7))))
                .when(classifier).classify(anyList());

        ScanException e = assertThrows(ScanException.class, () -> service.infer(request("IMAGE", paths(1))));

        assertEquals(500, e.getStatus());
        assertEquals("Inference failed", e.getError());
        assertTrue(loadedFrames.get(0).isReleased());
    }

    @Test
    void mismatchedClassifierOutputFails() {
        doReturn(Collections.emptyList()).when(classifier).classify(anyList());

        assertThrows(IllegalStateException.class, () -> service.infer(request("VIDEO", paths(3))));
    }

    @Test
    void healthReflectsClassifierState() {
        HealthStatus healthy = service.health();
        assertTrue(healthy.isHealthy());
        assertEquals("loaded", healthy.getModelStatus());
        assertEquals("test-model", healthy.getModel());
        assertEquals(config.getServiceName(), healthy.getService());
        assertEquals("not_initialized", healthy.getDetector());

        when(classifier.isReady()).thenReturn(false);
        HealthStatus unhealthy = service.health();
        assertEquals(HealthStatus.UNHEALTHY, unhealthy.getStatus());
        assertEquals("not_loaded", unhealthy.getModelStatus());
    }

    @Test
    void closeClosesClassifier() throws Exception {
        service.close();

        verify(classifier).close();
    }

    private static void assertStatus(int status, Runnable call) {
        ScanException e = assertThrows(ScanException.class, call::run);
        assertEquals(status, e.getStatus());
    }
}
