package com.deepfake.scan.processor;

import com.deepfake.scan.model.SemanticLabel;

import java.io.Serializable;

/**
 * 分类器标签文本到语义的映射，每种分类器后端可以有自己的实现
 */
@FunctionalInterface
public interface LabelMapper extends Serializable {

    SemanticLabel map(String label);
}
