package com.deepfake.scan.processor;

import com.deepfake.scan.exception.InvalidScoreException;
import com.deepfake.scan.model.LabelScore;

import java.io.Serializable;
import java.util.List;

/**
 * 从单帧分类结果中提取"伪造概率"
 *
 * 规则（先命中者生效，不依赖列表顺序）：
 * 1. 任一伪造标签 -> 该标签得分
 * 2. 任一真实标签 -> 1 - 该标签得分
 * 3. 否则取第一个条目的原始得分（极性未知，按二分类处理）
 * 4. 空结果 -> 0.5
 */
public class FakeProbabilityExtractor implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double UNCERTAIN = 0.5;

    private final LabelMapper labelMapper;

    public FakeProbabilityExtractor() {
        this(new KeywordLabelMapper());
    }

    public FakeProbabilityExtractor(LabelMapper labelMapper) {
        this.labelMapper = labelMapper;
    }

    public double extract(List<LabelScore> result) {
        if (result == null || result.isEmpty()) {
            return UNCERTAIN;
        }

        for (LabelScore entry : result) {
            if (labelMapper.map(entry.getLabel()).isFake()) {
                return checkedScore(entry);
            }
        }
        for (LabelScore entry : result) {
            if (labelMapper.map(entry.getLabel()).isReal()) {
                return 1.0 - checkedScore(entry);
            }
        }

        // 没有可识别的标签，第一个条目视为主类
        return checkedScore(result.get(0));
    }

    private static double checkedScore(LabelScore entry) {
        double score = entry.getScore();
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new InvalidScoreException(
                    "Classifier score out of range for label '" + entry.getLabel() + "': " + score);
        }
        return score;
    }
}
