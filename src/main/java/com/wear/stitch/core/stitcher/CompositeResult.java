package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Canvas;

public final class CompositeResult {
    private final Canvas canvas;
    private final long gapPixels;

    public CompositeResult(Canvas canvas, long gapPixels) {
        this.canvas = canvas;
        this.gapPixels = gapPixels;
    }

    public Canvas getCanvas() { return canvas; }

    /**
     * 完全没有来源像素、被填充为透明的像素数
     */
    public long getGapPixels() { return gapPixels; }
}
