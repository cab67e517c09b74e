package com.deepfake.scan.model;

import lombok.Value;

import java.io.Serializable;

/**
 * 分类器输出的单个标签及其得分
 */
@Value
public class LabelScore implements Serializable {

    private static final long serialVersionUID = 1L;

    String label;

    double score;
}
