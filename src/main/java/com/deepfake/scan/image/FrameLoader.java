package com.deepfake.scan.image;

/**
 * 帧文件加载
 */
@FunctionalInterface
public interface FrameLoader {

    /**
     * @throws com.deepfake.scan.exception.InvalidInputException 文件不存在或无法解码
     */
    FrameImage load(String path);
}
