package com.deepfake.scan.exception;

/**
 * 非法输入：空帧列表、未知媒体类型、无法解析的请求或图像，不重试
 */
public class InvalidInputException extends ScanException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(400, "Invalid request", message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(400, "Invalid request", message, cause);
    }
}
