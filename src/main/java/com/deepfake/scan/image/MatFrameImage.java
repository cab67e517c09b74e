package com.deepfake.scan.image;

import com.deepfake.scan.model.CropRegion;
import com.deepfake.scan.util.ImageUtils;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 基于OpenCV Mat的帧图像（BGR通道）
 */
public class MatFrameImage implements FrameImage {

    private final Mat mat;

    public MatFrameImage(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Image matrix is empty");
        }
        if (mat.channels() != 3) {
            throw new IllegalArgumentException("Expected a 3-channel image, got " + mat.channels());
        }
        this.mat = mat;
    }

    @Override
    public int getWidth() {
        return mat.cols();
    }

    @Override
    public int getHeight() {
        return mat.rows();
    }

    @Override
    public FrameImage crop(CropRegion region) {
        Mat roi = mat.submat(new Rect(region.getX(), region.getY(), region.getWidth(), region.getHeight()));
        try {
            return new MatFrameImage(roi.clone());
        } finally {
            roi.release();
        }
    }

    @Override
    public float[] toTensor(int inputSize) {
        Mat resized = new Mat();
        try {
            Imgproc.resize(mat, resized, new Size(inputSize, inputSize));
            return ImageUtils.matToFloatArray(resized);
        } finally {
            resized.release();
        }
    }

    /**
     * 只读访问底层矩阵，调用方不得修改
     */
    public Mat mat() {
        return mat;
    }

    @Override
    public void release() {
        ImageUtils.safeRelease(mat, "frame image");
    }
}
