package com.deepfake.scan.processor;

import com.deepfake.scan.model.BoundingBox;
import com.deepfake.scan.model.CropRegion;

import java.io.Serializable;

/**
 * 人脸裁剪几何：以人脸中心为中心、按比例外扩的正方形，平移后保证落在图像内
 *
 * 对输出再次应用不是幂等的（外扩会叠加）
 */
public class FaceCropGeometry implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_PADDING_PERCENT = 30;

    private final int paddingPercent;

    public FaceCropGeometry() {
        this(DEFAULT_PADDING_PERCENT);
    }

    public FaceCropGeometry(int paddingPercent) {
        if (paddingPercent < 0) {
            throw new IllegalArgumentException("Padding percent must be non-negative: " + paddingPercent);
        }
        this.paddingPercent = paddingPercent;
    }

    public CropRegion compute(int imageWidth, int imageHeight, BoundingBox box) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + imageWidth + "x" + imageHeight);
        }
        if (box == null || box.getWidth() <= 0 || box.getHeight() <= 0) {
            throw new IllegalArgumentException("Face box must have positive size: " + box);
        }

        double centerX = box.getX() + box.getWidth() / 2.0;
        double centerY = box.getY() + box.getHeight() / 2.0;
        int maxDim = Math.max(box.getWidth(), box.getHeight());

        int size = (int) Math.floor(maxDim * (1 + paddingPercent / 100.0));
        // 图像比正方形小时只能取短边，否则无法同时满足正方形和不越界
        size = Math.min(size, Math.min(imageWidth, imageHeight));
        int halfSize = size / 2;

        int x1 = (int) Math.max(0, centerX - halfSize);
        int y1 = (int) Math.max(0, centerY - halfSize);
        int x2 = (int) Math.min(imageWidth, centerX + halfSize);
        int y2 = (int) Math.min(imageHeight, centerY + halfSize);

        // 被边界截断时向图像内部平移，尽量保持完整尺寸
        if (x2 - x1 < size) {
            if (x1 == 0) {
                x2 = Math.min(imageWidth, size);
            } else if (x2 == imageWidth) {
                x1 = Math.max(0, imageWidth - size);
            }
        }
        if (y2 - y1 < size) {
            if (y1 == 0) {
                y2 = Math.min(imageHeight, size);
            } else if (y2 == imageHeight) {
                y1 = Math.max(0, imageHeight - size);
            }
        }

        x2 = Math.min(imageWidth, x1 + size);
        y2 = Math.min(imageHeight, y1 + size);
        x1 = Math.max(0, x2 - size);
        y1 = Math.max(0, y2 - size);

        return CropRegion.of(x1, y1, x2 - x1, imageWidth, imageHeight);
    }

    public int getPaddingPercent() {
        return paddingPercent;
    }
}
