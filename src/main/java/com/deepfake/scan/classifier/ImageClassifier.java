package com.deepfake.scan.classifier;

import com.deepfake.scan.image.FrameImage;
import com.deepfake.scan.model.LabelScore;

import java.util.List;

/**
 * 图像分类器契约：一批图像进，每张图像一组标签得分出
 *
 * 批大小为1时同样返回只含一个元素的列表
 */
public interface ImageClassifier extends AutoCloseable {

    /**
     * @throws com.deepfake.scan.exception.ClassifierUnavailableException 模型未就绪
     */
    List<List<LabelScore>> classify(List<FrameImage> images);

    boolean isReady();

    String getModelName();

    @Override
    default void close() {
    }
}
