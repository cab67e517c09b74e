package com.deepfake.scan.detector;

import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.Detection;
import com.deepfake.scan.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Haar级联人脸检测器（DNN模型不可用时的后备）
 *
 * 级联分类器不给出置信度，所有命中都记为1.0
 */
public class HaarFaceDetector implements FaceDetector {

    private static final Logger LOG = LoggerFactory.getLogger(HaarFaceDetector.class);

    private static final double SCALE_FACTOR = 1.1;
    private static final int MIN_NEIGHBORS = 5;
    private static final Size MIN_SIZE = new Size(30, 30);

    private final CascadeClassifier classifier;
    private final float confidenceThreshold;

    private final Object lock = new Object();

    public HaarFaceDetector(String cascadePath, float confidenceThreshold) {
        ImageUtils.ensureOpenCvLoaded();
        this.classifier = new CascadeClassifier(cascadePath);
        if (classifier.empty()) {
            throw new IllegalStateException("Could not load Haar cascade: " + cascadePath);
        }
        this.confidenceThreshold = confidenceThreshold;
        LOG.info("Haar cascade face detector loaded from: {}", cascadePath);
    }

    @Override
    public List<Detection> detect(FrameImage image) {
        Mat source = ImageUtils.toMat(image);
        Mat gray = new Mat();
        MatOfRect faces = new MatOfRect();
        try {
            Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGR2GRAY);
            synchronized (lock) {
                classifier.detectMultiScale(gray, faces, SCALE_FACTOR, MIN_NEIGHBORS, 0, MIN_SIZE, new Size());
            }

            List<Detection> detections = new ArrayList<>();
            for (Rect rect : faces.toArray()) {
                detections.add(new Detection(new BoundingBox(rect.x, rect.y, rect.width, rect.height), 1.0f));
            }
            return detections;
        } finally {
            ImageUtils.safeRelease(faces, "face rects");
            ImageUtils.safeRelease(gray, "gray Mat");
        }
    }

    @Override
    public FaceDetectorBackend getBackend() {
        return FaceDetectorBackend.HAAR;
    }

    @Override
    public float getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
