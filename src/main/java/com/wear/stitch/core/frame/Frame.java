package com.wear.stitch.core.frame;

import java.util.function.IntBinaryOperator;

/**
 * 一帧截屏图像（只读）
 * <p>
 * 像素按行优先存储为 ARGB int：{@code A<<24 | R<<16 | G<<8 | B}。
 * 帧序号即其在输入序列中的位置，由调用方维护。
 */
public final class Frame {
    private final int width;
    private final int height;
    private final int[] pixels;

    public Frame(int width, int height, int[] argb) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid frame size: " + width + "x" + height);
        }
        if (argb == null || argb.length != width * height) {
            throw new IllegalArgumentException("Pixel buffer does not match frame size " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = argb.clone();
    }

    /**
     * 按坐标生成帧，便于构造合成图像
     */
    public static Frame generate(int width, int height, IntBinaryOperator argbAt) {
        int[] argb = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                argb[y * width + x] = argbAt.applyAsInt(x, y);
            }
        }
        return new Frame(width, height, argb);
    }

    public static Frame solid(int width, int height, int argb) {
        return generate(width, height, (x, y) -> argb);
    }

    public int getWidth() { return width; }

    public int getHeight() { return height; }

    public int argb(int x, int y) {
        return pixels[y * width + x];
    }

    /**
     * 去掉 alpha 后的颜色值，等价于 R*65536 + G*256 + B
     */
    public int rgb(int x, int y) {
        return pixels[y * width + x] & 0xFFFFFF;
    }

    public int[] toArgbArray() {
        return pixels.clone();
    }
}
