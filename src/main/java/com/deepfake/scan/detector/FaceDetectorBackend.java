package com.deepfake.scan.detector;

/**
 * 人脸检测后端
 */
public enum FaceDetectorBackend {
    DNN("OpenCV DNN (SSD ResNet-10)"),
    HAAR("OpenCV Haar Cascade (fallback)"),
    NONE("none");

    private final String description;

    FaceDetectorBackend(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
