package com.deepfake.scan.processor;

import com.deepfake.scan.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 帧采样：按固定步长抽帧并保持顺序
 *
 * 帧数不是步长整数倍时间隔并不完全均匀，尾部帧可能不被覆盖，这是可接受的近似
 */
public final class FrameSampler {

    private FrameSampler() {
    }

    /**
     * @param maxFrames 最大帧数，null 表示不限制
     */
    public static <T> List<T> sample(List<T> frames, Integer maxFrames) {
        if (frames == null) {
            return Collections.emptyList();
        }
        if (maxFrames != null && maxFrames <= 0) {
            throw new InvalidInputException("maxFrames must be positive: " + maxFrames);
        }
        if (maxFrames == null || frames.size() <= maxFrames) {
            return new ArrayList<>(frames);
        }

        int stride = frames.size() / maxFrames;
        List<T> sampled = new ArrayList<>(maxFrames);
        for (int i = 0; i < frames.size() && sampled.size() < maxFrames; i += stride) {
            sampled.add(frames.get(i));
        }
        return sampled;
    }
}
