package com.deepfake.scan.model;

import lombok.Value;

import java.io.Serializable;

/**
 * 模型输入用的正方形裁剪区域，保证完全落在源图像内
 */
@Value
public class CropRegion implements Serializable {

    private static final long serialVersionUID = 1L;

    int x;
    int y;
    int size;

    private CropRegion(int x, int y, int size) {
        this.x = x;
        this.y = y;
        this.size = size;
    }

    public static CropRegion of(int x, int y, int size, int imageWidth, int imageHeight) {
        if (size <= 0 || x < 0 || y < 0 || x + size > imageWidth || y + size > imageHeight) {
            throw new IllegalStateException(String.format(
                    "Crop region (%d,%d,%d) outside image %dx%d", x, y, size, imageWidth, imageHeight));
        }
        return new CropRegion(x, y, size);
    }

    public int getWidth() {
        return size;
    }

    public int getHeight() {
        return size;
    }

    public BoundingBox toBoundingBox() {
        return new BoundingBox(x, y, size, size);
    }
}
