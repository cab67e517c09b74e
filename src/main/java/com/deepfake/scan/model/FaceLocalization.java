package com.deepfake.scan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * 单帧人脸定位结果：人脸裁剪区域，或者未检测到人脸时使用整张图像
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FaceLocalization {

    private static final FaceLocalization FULL_IMAGE = new FaceLocalization(null, null);

    private final CropRegion cropRegion;

    private final BoundingBox faceBox;

    public static FaceLocalization cropped(CropRegion cropRegion, BoundingBox faceBox) {
        if (cropRegion == null || faceBox == null) {
            throw new IllegalArgumentException("Crop region and face box are required");
        }
        return new FaceLocalization(cropRegion, faceBox);
    }

    public static FaceLocalization fullImage() {
        return FULL_IMAGE;
    }

    public boolean isFullImage() {
        return cropRegion == null;
    }

    public Optional<CropRegion> crop() {
        return Optional.ofNullable(cropRegion);
    }

    @Override
    public String toString() {
        return isFullImage() ? "FaceLocalization[full image]"
                : "FaceLocalization[crop=" + cropRegion + ", face=" + faceBox + "]";
    }
}
