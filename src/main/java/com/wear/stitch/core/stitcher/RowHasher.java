package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Frame;

import java.util.stream.IntStream;

/**
 * 行哈希计算
 * <p>
 * 多项式哈希（Horner），系数为像素 RGB 值，只取行中间 40% 的列：
 * 圆形屏幕的左右边缘会被裁掉，边缘像素不可靠。
 * <pre>
 * hash = 1
 * for x in [floor(0.3W), floor(0.7W)):
 *     hash = hash * 31 + (R*65536 + G*256 + B)   (mod 2^64)
 * </pre>
 */
public class RowHasher {
    static final long SEED = 1L;
    static final long MULTIPLIER = 31L;
    static final double BAND_START = 0.3;
    static final double BAND_END = 0.7;

    private final boolean parallel;

    public RowHasher() {
        this(false);
    }

    /**
     * @param parallel 是否并行计算各行（行之间无依赖）
     */
    public RowHasher(boolean parallel) {
        this.parallel = parallel;
    }

    public static int bandStart(int width) {
        return (int) (width * BAND_START);
    }

    public static int bandEnd(int width) {
        return (int) (width * BAND_END);
    }

    public RowHash hash(Frame frame) {
        int width = frame.getWidth();
        int height = frame.getHeight();
        int from = bandStart(width);
        int to = bandEnd(width);

        long[] values = new long[height];
        IntStream rows = IntStream.range(0, height);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(y -> values[y] = hashRow(frame, y, from, to));

        return new RowHash(values, from >= to);
    }

    private static long hashRow(Frame frame, int y, int from, int to) {
        long hash = SEED;
        for (int x = from; x < to; x++) {
            hash = hash * MULTIPLIER + frame.rgb(x, y);
        }
        return hash;
    }
}
