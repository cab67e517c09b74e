package com.deepfake.scan.model;

import lombok.Value;

import java.io.Serializable;

/**
 * 像素坐标系下的矩形框（左上角为原点）
 */
@Value
public class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    int x;
    int y;
    int width;
    int height;

    public BoundingBox(int x, int y, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "Bounding box size must be non-negative: " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * 由左上、右下两点构造，右下点小于左上点时宽高记为0
     */
    public static BoundingBox fromCorners(int x1, int y1, int x2, int y2) {
        return new BoundingBox(x1, y1, Math.max(0, x2 - x1), Math.max(0, y2 - y1));
    }

    public int getRight() {
        return x + width;
    }

    public int getBottom() {
        return y + height;
    }

    public long getArea() {
        return (long) width * height;
    }
}
