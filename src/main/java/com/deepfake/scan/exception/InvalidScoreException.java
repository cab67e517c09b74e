package com.deepfake.scan.exception;

/**
 * 分类器给出的分数无法解释（NaN或不在[0,1]内），通常是模型或标签配置错误，不是请求方的问题
 */
public class InvalidScoreException extends ScanException {

    private static final long serialVersionUID = 1L;

    public InvalidScoreException(String message) {
        super(500, "Inference failed", message);
    }
}
