package com.deepfake.scan.model;

import lombok.Value;

import java.io.Serializable;

/**
 * 单个人脸检测结果
 */
@Value
public class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 检测框（未裁剪到图像边界）
     */
    BoundingBox box;

    /**
     * 置信度 (0-1)
     */
    float confidence;
}
