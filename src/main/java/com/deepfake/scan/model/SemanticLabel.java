package com.deepfake.scan.model;

import lombok.Value;

/**
 * 分类器标签的语义：伪造 / 真实 / 未知
 */
@Value
public class SemanticLabel {

    public enum Kind {
        FAKE,
        REAL,
        UNKNOWN
    }

    Kind kind;

    /**
     * 分类器原始标签文本
     */
    String rawText;

    public static SemanticLabel fake(String rawText) {
        return new SemanticLabel(Kind.FAKE, rawText);
    }

    public static SemanticLabel real(String rawText) {
        return new SemanticLabel(Kind.REAL, rawText);
    }

    public static SemanticLabel unknown(String rawText) {
        return new SemanticLabel(Kind.UNKNOWN, rawText);
    }

    public boolean isFake() {
        return kind == Kind.FAKE;
    }

    public boolean isReal() {
        return kind == Kind.REAL;
    }
}
