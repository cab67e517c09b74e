package com.deepfake.scan.model;

import com.deepfake.scan.exception.InvalidInputException;

import java.util.Locale;

/**
 * 扫描请求的媒体类型
 */
public enum MediaType {
    IMAGE,
    VIDEO,
    AUDIO;

    public static MediaType fromWire(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidInputException("Media type is required");
        }
        try {
            return MediaType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown media type: " + value);
        }
    }
}
