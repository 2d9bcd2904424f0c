package com.wear.stitch.core.stitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 累加每帧偏移，得到每个源行在输出画布中的绝对位置
 * <p>
 * 每帧只与紧邻的上一帧匹配，必须按帧号顺序处理；误差会累积，不做全局重对齐。
 */
public class ContributionAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ContributionAggregator.class);

    private final OffsetMatcher matcher;

    public ContributionAggregator(OffsetMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @param rowHashes 按帧号排列的行哈希，高度即各帧高度
     */
    public Alignment aggregate(List<RowHash> rowHashes) {
        ContributionMap map = new ContributionMap();
        List<FrameAlignment> frames = new ArrayList<>(rowHashes.size());
        if (rowHashes.isEmpty()) {
            return new Alignment(map, frames);
        }

        RowHash first = rowHashes.get(0);
        for (int y = 0; y < first.length(); y++) {
            map.add(y, new Contribution(0, y));
        }
        frames.add(new FrameAlignment(0, 0, 0, 0));

        int absoluteOffset = 0;
        for (int i = 1; i < rowHashes.size(); i++) {
            RowHash current = rowHashes.get(i);
            OffsetMatch match = matcher.match(rowHashes.get(i - 1), current);
            logger.info("Match for frame {} - ({}, {})", i, match.getScore(), match.getOffset());

            absoluteOffset += match.getOffset();
            for (int y = 0; y < current.length(); y++) {
                map.add(y + absoluteOffset, new Contribution(i, y));
            }
            frames.add(new FrameAlignment(i, match.getScore(), match.getOffset(), absoluteOffset));
        }

        return new Alignment(map, frames);
    }
}
