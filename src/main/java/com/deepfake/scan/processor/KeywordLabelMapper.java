package com.deepfake.scan.processor;

import com.deepfake.scan.model.SemanticLabel;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 基于关键字（不区分大小写的子串匹配）的标签映射
 *
 * 伪造关键字优先于真实关键字
 */
public class KeywordLabelMapper implements LabelMapper {

    private static final long serialVersionUID = 1L;

    public static final List<String> DEFAULT_FAKE_KEYWORDS =
            Collections.unmodifiableList(Arrays.asList("fake", "deepfake", "synthetic"));
    public static final List<String> DEFAULT_REAL_KEYWORDS =
            Collections.unmodifiableList(Arrays.asList("real", "authentic"));

    private final List<String> fakeKeywords;
    private final List<String> realKeywords;

    public KeywordLabelMapper() {
        this(DEFAULT_FAKE_KEYWORDS, DEFAULT_REAL_KEYWORDS);
    }

    public KeywordLabelMapper(List<String> fakeKeywords, List<String> realKeywords) {
        this.fakeKeywords = lowerCase(fakeKeywords);
        this.realKeywords = lowerCase(realKeywords);
    }

    @Override
    public SemanticLabel map(String label) {
        String raw = label == null ? "" : label;
        String text = raw.toLowerCase(Locale.ROOT);
        if (containsAny(text, fakeKeywords)) {
            return SemanticLabel.fake(raw);
        }
        if (containsAny(text, realKeywords)) {
            return SemanticLabel.real(raw);
        }
        return SemanticLabel.unknown(raw);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCase(List<String> keywords) {
        String[] result = new String[keywords.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = keywords.get(i).toLowerCase(Locale.ROOT);
        }
        return Collections.unmodifiableList(Arrays.asList(result));
    }
}
