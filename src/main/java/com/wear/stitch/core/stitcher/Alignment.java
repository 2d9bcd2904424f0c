package com.wear.stitch.core.stitcher;

import java.util.List;

/**
 * 对齐结果：贡献表 + 每帧的偏移诊断
 */
public final class Alignment {
    private final ContributionMap contributions;
    private final List<FrameAlignment> frames;

    public Alignment(ContributionMap contributions, List<FrameAlignment> frames) {
        this.contributions = contributions;
        this.frames = List.copyOf(frames);
    }

    public ContributionMap getContributions() { return contributions; }

    public List<FrameAlignment> getFrames() { return frames; }

    public int absoluteOffset(int frameIndex) {
        return frames.get(frameIndex).getAbsoluteOffset();
    }
}
