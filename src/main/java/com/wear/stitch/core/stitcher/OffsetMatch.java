package com.wear.stitch.core.stitcher;

/**
 * 偏移匹配结果：score 为对齐后相同行哈希的数量，offset 为相对上一帧下滚的行数
 */
public final class OffsetMatch {
    private final int score;
    private final int offset;

    public OffsetMatch(int score, int offset) {
        this.score = score;
        this.offset = offset;
    }

    public int getScore() { return score; }

    public int getOffset() { return offset; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetMatch)) return false;
        OffsetMatch that = (OffsetMatch) o;
        return score == that.score && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return 31 * score + offset;
    }

    @Override
    public String toString() {
        return "(" + score + ", " + offset + ")";
    }
}
