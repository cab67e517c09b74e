package com.deepfake.scan.util;

import com.deepfake.scan.exception.InvalidInputException;
import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.image.MatFrameImage;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图像处理工具类
 */
public final class ImageUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ImageUtils.class);

    private static volatile boolean openCvLoaded = false;

    private ImageUtils() {
    }

    /**
     * 加载OpenCV本地库（只加载一次）
     */
    public static void ensureOpenCvLoaded() {
        if (openCvLoaded) {
            return;
        }
        synchronized (ImageUtils.class) {
            if (!openCvLoaded) {
                nu.pattern.OpenCV.loadLocally();
                openCvLoaded = true;
                LOG.info("OpenCV loaded successfully");
            }
        }
    }

    /**
     * 读取图像文件为BGR三通道Mat
     */
    public static Mat readColorImage(String path) {
        ensureOpenCvLoaded();
        return Imgcodecs.imread(path, Imgcodecs.IMREAD_COLOR);
    }

    /**
     * 将BGR Mat转换为float数组（RGB，归一化到[0,1]，CHW格式）
     *
     * 分类模型训练时只做了 Resize + ToTensor，这里不做均值方差归一化
     */
    public static float[] matToFloatArray(Mat mat) {
        Mat rgb = new Mat();
        Imgproc.cvtColor(mat, rgb, Imgproc.COLOR_BGR2RGB);

        int channels = rgb.channels();
        int height = rgb.rows();
        int width = rgb.cols();

        float[] result = new float[channels * height * width];
        byte[] data = new byte[(int) rgb.total() * channels];
        rgb.get(0, 0, data);

        for (int c = 0; c < channels; c++) {
            for (int h = 0; h < height; h++) {
                for (int w = 0; w < width; w++) {
                    int pixelIndex = (h * width + w) * channels + c;
                    int resultIndex = c * height * width + h * width + w;
                    result[resultIndex] = (data[pixelIndex] & 0xFF) / 255.0f;
                }
            }
        }

        rgb.release();
        return result;
    }

    /**
     * OpenCV检测器只能处理Mat实现的帧
     */
    public static Mat toMat(FrameImage image) {
        if (image instanceof MatFrameImage) {
            return ((MatFrameImage) image).mat();
        }
        throw new InvalidInputException("Unsupported image implementation: "
                + (image == null ? "null" : image.getClass().getSimpleName()));
    }

    /**
     * 安全释放Mat
     */
    public static void safeRelease(Mat mat, String name) {
        if (mat != null) {
            try {
                mat.release();
            } catch (Exception e) {
                LOG.error("Error releasing {}", name, e);
            }
        }
    }
}
