package com.wear.stitch.core.stitcher;

/**
 * 单帧对齐诊断信息
 * <p>
 * 第 0 帧不参与匹配：score、offset、absoluteOffset 均为 0。
 */
public final class FrameAlignment {
    private final int frameIndex;
    private final int score;
    private final int offset;
    private final int absoluteOffset;

    public FrameAlignment(int frameIndex, int score, int offset, int absoluteOffset) {
        this.frameIndex = frameIndex;
        this.score = score;
        this.offset = offset;
        this.absoluteOffset = absoluteOffset;
    }

    public int getFrameIndex() { return frameIndex; }

    public int getScore() { return score; }

    public int getOffset() { return offset; }

    public int getAbsoluteOffset() { return absoluteOffset; }

    @Override
    public String toString() {
        return "FrameAlignment{frame=" + frameIndex + ", score=" + score
                + ", offset=" + offset + ", absoluteOffset=" + absoluteOffset + "}";
    }
}
