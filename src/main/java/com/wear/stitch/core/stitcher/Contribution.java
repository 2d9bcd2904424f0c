package com.wear.stitch.core.stitcher;

/**
 * 输出行的一个像素来源：第 frameIndex 帧的第 sourceRow 行
 */
public final class Contribution {
    private final int frameIndex;
    private final int sourceRow;

    public Contribution(int frameIndex, int sourceRow) {
        this.frameIndex = frameIndex;
        this.sourceRow = sourceRow;
    }

    public int getFrameIndex() { return frameIndex; }

    public int getSourceRow() { return sourceRow; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Contribution)) return false;
        Contribution that = (Contribution) o;
        return frameIndex == that.frameIndex && sourceRow == that.sourceRow;
    }

    @Override
    public int hashCode() {
        return 31 * frameIndex + sourceRow;
    }

    @Override
    public String toString() {
        return "(" + frameIndex + ", " + sourceRow + ")";
    }
}
