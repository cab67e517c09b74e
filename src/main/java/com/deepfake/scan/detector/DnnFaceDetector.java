package com.deepfake.scan.detector;

import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.Detection;
import com.deepfake.scan.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenCV DNN人脸检测器（Caffe SSD, ResNet-10 骨干）
 * 输出格式: [1, 1, N, 7]，每行为 [_, _, confidence, x1, y1, x2, y2]，坐标已归一化
 */
public class DnnFaceDetector implements FaceDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DnnFaceDetector.class);

    private static final int INPUT_SIZE = 300;
    private static final Scalar MEAN = new Scalar(104.0, 177.0, 123.0);

    private final Net net;
    private final float confidenceThreshold;

    // Net 不是线程安全的
    private final Object lock = new Object();

    public DnnFaceDetector(String configPath, String modelPath, float confidenceThreshold) {
        ImageUtils.ensureOpenCvLoaded();
        this.net = Dnn.readNetFromCaffe(configPath, modelPath);
        if (net.empty()) {
            throw new IllegalStateException("Failed to load DNN face detector from " + modelPath);
        }
        this.confidenceThreshold = confidenceThreshold;
        LOG.info("DNN face detector loaded from: {}", modelPath);
    }

    @Override
    public List<Detection> detect(FrameImage image) {
        Mat source = ImageUtils.toMat(image);
        int width = source.cols();
        int height = source.rows();

        Mat resized = new Mat();
        Mat blob = null;
        Mat output = null;
        Mat rows = null;
        try {
            Imgproc.resize(source, resized, new Size(INPUT_SIZE, INPUT_SIZE));
            blob = Dnn.blobFromImage(resized, 1.0, new Size(INPUT_SIZE, INPUT_SIZE), MEAN, false, false);

            synchronized (lock) {
                net.setInput(blob);
                output = net.forward();
            }

            rows = output.reshape(1, (int) output.total() / 7);
            List<Detection> detections = new ArrayList<>();
            for (int i = 0; i < rows.rows(); i++) {
                float confidence = (float) rows.get(i, 2)[0];
                int x1 = (int) (rows.get(i, 3)[0] * width);
                int y1 = (int) (rows.get(i, 4)[0] * height);
                int x2 = (int) (rows.get(i, 5)[0] * width);
                int y2 = (int) (rows.get(i, 6)[0] * height);
                detections.add(new Detection(BoundingBox.fromCorners(x1, y1, x2, y2), confidence));
            }

            LOG.debug("DNN detector produced {} candidates for {}x{} image", detections.size(), width, height);
            return detections;
        } finally {
            ImageUtils.safeRelease(rows, "detection rows");
            ImageUtils.safeRelease(output, "detection output");
            ImageUtils.safeRelease(blob, "input blob");
            ImageUtils.safeRelease(resized, "resized Mat");
        }
    }

    @Override
    public FaceDetectorBackend getBackend() {
        return FaceDetectorBackend.DNN;
    }

    @Override
    public float getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
