package com.deepfake.scan.exception;

/**
 * 分类模型未就绪，与推理失败区分开
 */
public class ClassifierUnavailableException extends ScanException {

    private static final long serialVersionUID = 1L;

    public ClassifierUnavailableException(String message) {
        super(503, "Service Unavailable", message);
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(503, "Service Unavailable", message, cause);
    }
}
