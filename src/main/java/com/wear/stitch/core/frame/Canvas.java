package com.wear.stitch.core.frame;

/**
 * 拼接输出画布（RGBA）
 * <p>
 * 按行从上到下填充；合成过程中只读取已经完成的行。
 * 新建画布全部为透明黑 (0,0,0,0)。
 */
public final class Canvas {
    public static final int TRANSPARENT = 0x00000000;

    private final int width;
    private final int height;
    private final int[] pixels;

    public Canvas(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid canvas size: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = new int[width * height];
    }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    public int get(int x, int y) {
        return pixels[y * width + x];
    }

    public void set(int x, int y, int argb) {
        pixels[y * width + x] = argb;
    }

    /**
     * 转为不可变帧，用于编码输出
     */
    public Frame toFrame() {
        return new Frame(width, height, pixels);
    }
}
