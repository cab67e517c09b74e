package com.deepfake.scan.processor;

import com.deepfake.scan.detector.FaceDetector;
import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.CropRegion;
import com.deepfake.scan.model.Detection;
import com.deepfake.scan.model.FaceLocalization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 单帧人脸定位：检测 -> 选框 -> 计算裁剪区域
 *
 * 未检测到人脸时返回整图标记，并计数以便监控质量
 */
public class FaceLocalizer {

    private static final Logger LOG = LoggerFactory.getLogger(FaceLocalizer.class);

    private final Supplier<FaceDetector> detectorSupplier;
    private final FaceCropGeometry geometry;

    // 统计信息
    private final AtomicLong framesLocalized = new AtomicLong(0);
    private final AtomicLong fullImageFallbacks = new AtomicLong(0);
    private final AtomicLong detectorFailures = new AtomicLong(0);

    public FaceLocalizer(Supplier<FaceDetector> detectorSupplier, FaceCropGeometry geometry) {
        this.detectorSupplier = detectorSupplier;
        this.geometry = geometry;
    }

    public FaceLocalization localize(FrameImage image) {
        framesLocalized.incrementAndGet();
        int width = image.getWidth();
        int height = image.getHeight();

        FaceDetector detector = detectorSupplier.get();
        List<Detection> detections;
        try {
            detections = detector.detect(image);
        } catch (RuntimeException e) {
            // 检测器故障按未检测到人脸处理，单独计数
            detectorFailures.incrementAndGet();
            LOG.error("Face detector {} failed on {}x{} image, using full image",
                    detector.getBackend(), width, height, e);
            return fallback();
        }

        BoundingBoxSelector selector = new BoundingBoxSelector(detector.getConfidenceThreshold());
        Optional<BoundingBox> face = selector.select(detections, width, height);
        if (!face.isPresent()) {
            LOG.warn("No face detected in image of size {}x{}, using full image (may cause incorrect predictions)",
                    width, height);
            return fallback();
        }

        CropRegion crop = geometry.compute(width, height, face.get());
        LOG.debug("Face found at {} in {}x{} image, crop {}", face.get(), width, height, crop);
        return FaceLocalization.cropped(crop, face.get());
    }

    private FaceLocalization fallback() {
        long fallbacks = fullImageFallbacks.incrementAndGet();
        if (fallbacks % 100 == 0) {
            LOG.info("Full-image fallbacks: {} of {} frames", fallbacks, framesLocalized.get());
        }
        return FaceLocalization.fullImage();
    }

    public long getFramesLocalized() {
        return framesLocalized.get();
    }

    public long getFullImageFallbacks() {
        return fullImageFallbacks.get();
    }

    public long getDetectorFailures() {
        return detectorFailures.get();
    }
}
