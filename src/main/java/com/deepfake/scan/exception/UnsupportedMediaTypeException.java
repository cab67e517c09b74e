package com.deepfake.scan.exception;

import com.deepfake.scan.model.MediaType;

/**
 * 当前分类器不支持的媒体类型（如纯音频）
 */
public class UnsupportedMediaTypeException extends ScanException {

    private static final long serialVersionUID = 1L;

    public UnsupportedMediaTypeException(MediaType mediaType, String message) {
        super(400, "Unsupported media type", mediaType + ": " + message);
    }
}
