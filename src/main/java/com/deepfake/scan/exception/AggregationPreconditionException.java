package com.deepfake.scan.exception;

/**
 * 聚合前置条件不满足（空概率序列），说明上游流程有缺陷
 */
public class AggregationPreconditionException extends ScanException {

    private static final long serialVersionUID = 1L;

    public AggregationPreconditionException(String message) {
        super(500, "Inference failed", message);
    }
}
