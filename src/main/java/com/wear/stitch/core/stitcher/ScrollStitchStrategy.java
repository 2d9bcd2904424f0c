package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 纵向滚动截屏拼接策略
 * <p>
 * 流程：逐帧行哈希 → 相邻帧偏移匹配 → 累加绝对偏移 → 逐像素合成。
 * 适用于同一屏幕连续下滚得到的等宽截图（圆形或方形表盘）。
 */
public class ScrollStitchStrategy implements StitchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ScrollStitchStrategy.class);

    private final CompositeOptions options;
    private final RowHasher hasher;
    private final ContributionAggregator aggregator;
    private final Compositor compositor;

    public ScrollStitchStrategy(CompositeOptions options) {
        this.options = options;
        this.hasher = new RowHasher(options.isParallel());
        this.aggregator = new ContributionAggregator(new OffsetMatcher(options.isParallel()));
        this.compositor = new Compositor();
    }

    @Override
    public StitchResult stitch(List<Frame> frames) {
        validate(frames);
        long start = System.currentTimeMillis();

        // 1. 行哈希（每帧只算一次）
        List<RowHash> rowHashes = new ArrayList<>(frames.size());
        List<Integer> degenerate = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            RowHash hash = hasher.hash(frames.get(i));
            if (hash.isDegenerate()) {
                logger.warn("Frame {} is too narrow ({} px) for a sampling band, row hashes are constant",
                        i, frames.get(i).getWidth());
                degenerate.add(i);
            }
            rowHashes.add(hash);
        }

        // 2. 对齐
        Alignment alignment = aggregator.aggregate(rowHashes);
        int outputHeight = alignment.getContributions().rowCount();
        logger.info("Producing an image with height {} from {} frame(s), {}", outputHeight, frames.size(), options);

        // 3. 合成
        CompositeResult composite = compositor.composite(frames, alignment.getContributions(), options);

        long elapsed = System.currentTimeMillis() - start;
        logger.info("Stitched {}x{} in {} ms", composite.getCanvas().getWidth(), outputHeight, elapsed);
        return new StitchResult(composite.getCanvas(), alignment.getFrames(), degenerate,
                composite.getGapPixels(), elapsed);
    }

    public CompositeOptions getOptions() {
        return options;
    }

    private static void validate(List<Frame> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new FrameInputException("Frames cannot be null or empty");
        }
        int width = frames.get(0) == null ? 0 : frames.get(0).getWidth();
        for (int i = 0; i < frames.size(); i++) {
            Frame frame = frames.get(i);
            if (frame == null || frame.getWidth() == 0 || frame.getHeight() == 0) {
                throw new FrameInputException("Frame " + i + " is empty");
            }
            if (frame.getWidth() != width) {
                throw new FrameInputException("Frame " + i + " has width " + frame.getWidth()
                        + ", expected " + width + " (all frames must share the width of frame 0)");
            }
        }
    }
}
