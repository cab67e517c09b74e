package com.deepfake.scan.detector;

import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.Detection;

import java.util.Collections;
import java.util.List;

/**
 * 没有可用检测后端时使用，始终不返回人脸，调用方退化为整图
 */
public class NoOpFaceDetector implements FaceDetector {

    @Override
    public List<Detection> detect(FrameImage image) {
        return Collections.emptyList();
    }

    @Override
    public FaceDetectorBackend getBackend() {
        return FaceDetectorBackend.NONE;
    }

    @Override
    public float getConfidenceThreshold() {
        return 1.0f;
    }
}
