package com.deepfake.scan.image;

import com.deepfake.scan.model.CropRegion;

/**
 * 不可变的三通道帧图像
 *
 * 实现类持有本地内存时需在 {@link #release()} 中释放
 */
public interface FrameImage {

    int getWidth();

    int getHeight();

    /**
     * 返回裁剪后的新图像，不修改当前图像
     */
    FrameImage crop(CropRegion region);

    /**
     * 缩放到 inputSize x inputSize，RGB通道，归一化到[0,1]，CHW排列
     */
    float[] toTensor(int inputSize);

    default void release() {
    }
}
