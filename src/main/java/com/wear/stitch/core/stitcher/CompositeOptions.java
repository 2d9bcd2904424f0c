package com.wear.stitch.core.stitcher;

/**
 * 合成参数
 * <p>
 * circularMask: 圆形屏幕，内切圆以外的像素视为不在屏幕上；
 * transparency: 顶部/底部边缘无可用像素时填充全透明而不是最近的屏外像素；
 * parallel: 行内各列并行计算，并行哈希与偏移打分。
 */
public final class CompositeOptions {
    private final boolean circularMask;
    private final boolean transparency;
    private final boolean parallel;

    public CompositeOptions(boolean circularMask, boolean transparency, boolean parallel) {
        this.circularMask = circularMask;
        this.transparency = transparency;
        this.parallel = parallel;
    }

    public CompositeOptions(boolean circularMask, boolean transparency) {
        this(circularMask, transparency, false);
    }

    public boolean isCircularMask() { return circularMask; }

    public boolean isTransparency() { return transparency; }

    public boolean isParallel() { return parallel; }

    @Override
    public String toString() {
        return "CompositeOptions{circularMask=" + circularMask + ", transparency=" + transparency
                + ", parallel=" + parallel + "}";
    }
}
