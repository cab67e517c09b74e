package com.deepfake.scan.exception;

import lombok.Getter;

/**
 * 扫描处理异常基类，status 对应HTTP状态码语义
 */
@Getter
public class ScanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    private final String error;

    public ScanException(int status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    public ScanException(int status, String error, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.error = error;
    }
}
