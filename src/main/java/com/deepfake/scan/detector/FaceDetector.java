package com.deepfake.scan.detector;

import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.Detection;

import java.util.List;

/**
 * 人脸检测能力接口，后端可替换（DNN / Haar级联 / 无）
 */
public interface FaceDetector extends AutoCloseable {

    /**
     * @return 零个或多个检测结果，框坐标为原图像素，未做边界裁剪
     */
    List<Detection> detect(FrameImage image);

    FaceDetectorBackend getBackend();

    /**
     * 与当前后端召回能力匹配的置信度阈值
     */
    float getConfidenceThreshold();

    @Override
    default void close() {
    }
}
