package com.deepfake.scan.image;

import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.util.ImageUtils;
import org.opencv.core.Mat;

import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * 用OpenCV从磁盘读取帧，灰度和带透明通道的图像统一转为三通道
 */
public class OpenCvFrameLoader implements FrameLoader {

    public OpenCvFrameLoader() {
        ImageUtils.ensureOpenCvLoaded();
    }

    @Override
    public FrameImage load(String path) {
        if (path == null || path.trim().isEmpty()) {
            throw new InvalidInputException("Frame path is empty");
        }
        if (!Files.isRegularFile(Paths.get(path))) {
            throw new InvalidInputException("Image file not found: " + path);
        }

        Mat mat = ImageUtils.readColorImage(path);
        if (mat == null || mat.empty()) {
            ImageUtils.safeRelease(mat, "undecodable frame");
            throw new InvalidInputException("Failed to decode image: " + path);
        }
        return new MatFrameImage(mat);
    }
}
