package com.wear.stitch.core.stitcher;

/**
 * 一帧的逐行指纹
 * <p>
 * 每个值按无符号 64 位整数解释（Java long 的溢出即 mod 2^64）。
 */
public final class RowHash {
    private final long[] values;
    private final boolean degenerate;

    RowHash(long[] values, boolean degenerate) {
        this.values = values;
        this.degenerate = degenerate;
    }

    public static RowHash of(long... values) {
        return new RowHash(values.clone(), false);
    }

    public int length() {
        return values.length;
    }

    public long get(int row) {
        return values[row];
    }

    /**
     * 采样带为空（帧过窄），所有行哈希均为种子值
     */
    public boolean isDegenerate() {
        return degenerate;
    }

    public String toUnsignedString(int row) {
        return Long.toUnsignedString(values[row]);
    }
}
