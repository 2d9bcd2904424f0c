package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Canvas;

import java.util.List;

/**
 * 拼接结果：输出画布 + 诊断信息（非契约性，仅用于观察）
 */
public final class StitchResult {
    private final Canvas canvas;
    private final List<FrameAlignment> alignments;
    private final List<Integer> degenerateFrames;
    private final long gapPixels;
    private final long elapsedMs;

    public StitchResult(Canvas canvas, List<FrameAlignment> alignments, List<Integer> degenerateFrames,
                        long gapPixels, long elapsedMs) {
        this.canvas = canvas;
        this.alignments = List.copyOf(alignments);
        this.degenerateFrames = List.copyOf(degenerateFrames);
        this.gapPixels = gapPixels;
        this.elapsedMs = elapsedMs;
    }

    public Canvas getCanvas() { return canvas; }

    public List<FrameAlignment> getAlignments() { return alignments; }

    /**
     * 采样带为空、行哈希退化为常量的帧
     */
    public List<Integer> getDegenerateFrames() { return degenerateFrames; }

    public long getGapPixels() { return gapPixels; }

    public long getElapsedMs() { return elapsedMs; }

    public int getWidth() { return canvas.getWidth(); }

    public int getHeight() { return canvas.getHeight(); }
}
