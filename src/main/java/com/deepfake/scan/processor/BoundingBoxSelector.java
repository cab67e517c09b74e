package com.deepfake.scan.processor;

import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.Detection;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * 人脸框选择器：在置信度阈值之上选面积最大的检测框
 *
 * 阈值随检测后端而定：DNN检测器召回高用0.3，Haar级联用0.5
 */
public class BoundingBoxSelector implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final float DNN_CONFIDENCE_THRESHOLD = 0.3f;
    public static final float HAAR_CONFIDENCE_THRESHOLD = 0.5f;

    private final float confidenceThreshold;

    public BoundingBoxSelector(float confidenceThreshold) {
        if (Float.isNaN(confidenceThreshold) || confidenceThreshold < 0 || confidenceThreshold > 1) {
            throw new IllegalArgumentException("Confidence threshold must be in [0,1]: " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    /**
     * 选择最佳人脸框
     *
     * @return 裁剪到图像边界内的框；没有合格检测时为空（不是错误，调用方改用整图）
     */
    public Optional<BoundingBox> select(List<Detection> detections, int imageWidth, int imageHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + imageWidth + "x" + imageHeight);
        }
        if (detections == null || detections.isEmpty()) {
            return Optional.empty();
        }

        BoundingBox best = null;
        for (Detection detection : detections) {
            if (detection == null || detection.getBox() == null) {
                continue;
            }
            float confidence = detection.getConfidence();
            if (Float.isNaN(confidence) || confidence <= confidenceThreshold) {
                continue;
            }

            BoundingBox box = detection.getBox();
            int x1 = Math.max(0, box.getX());
            int y1 = Math.max(0, box.getY());
            int x2 = Math.min(imageWidth, box.getRight());
            int y2 = Math.min(imageHeight, box.getBottom());
            if (x2 <= x1 || y2 <= y1) {
                continue;
            }

            BoundingBox clamped = new BoundingBox(x1, y1, x2 - x1, y2 - y1);
            // 严格大于：面积相同时保留先出现的
            if (best == null || clamped.getArea() > best.getArea()) {
                best = clamped;
            }
        }
        return Optional.ofNullable(best);
    }

    public float getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
