package com.wear.stitch.core.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * 穷举偏移匹配
 * <p>
 * 对每个候选偏移 o ∈ [0, H)，统计 current[z] == previous[z + o] 的行数，
 * 取 (score, offset) 字典序最大者：分数相同时取较大的偏移。
 * 复杂度 O(H²)。
 */
public class OffsetMatcher {
    private static final Logger logger = LoggerFactory.getLogger(OffsetMatcher.class);

    private final boolean parallel;

    public OffsetMatcher() {
        this(false);
    }

    /**
     * @param parallel 是否并行计算各候选偏移的分数；选取过程始终顺序进行
     */
    public OffsetMatcher(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * @param previous 上一帧的行哈希
     * @param current  当前帧的行哈希
     * @return 最佳匹配；previous 为空时返回 (0, 0)
     */
    public OffsetMatch match(RowHash previous, RowHash current) {
        int candidates = previous.length();
        if (candidates == 0) {
            return new OffsetMatch(0, 0);
        }

        int[] scores = new int[candidates];
        IntStream offsets = IntStream.range(0, candidates);
        if (parallel) {
            offsets = offsets.parallel();
        }
        offsets.forEach(o -> scores[o] = score(previous, current, o));

        int bestScore = -1;
        int bestOffset = 0;
        for (int o = 0; o < candidates; o++) {
            // >= : 分数相同取较大的偏移
            if (scores[o] >= bestScore) {
                bestScore = scores[o];
                bestOffset = o;
            }
        }

        OffsetMatch best = new OffsetMatch(bestScore, bestOffset);
        logger.debug("Best match {} over {} candidate offsets", best, candidates);
        return best;
    }

    static int score(RowHash previous, RowHash current, int offset) {
        int overlap = Math.min(current.length(), previous.length() - offset);
        int score = 0;
        for (int z = 0; z < overlap; z++) {
            if (current.get(z) == previous.get(z + offset)) {
                score++;
            }
        }
        return score;
    }
}
