package com.wear.stitch.core.stitcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 绝对输出行 → 来源 (帧, 行) 列表
 * <p>
 * 以输出行号为下标的稠密列表；列表内顺序即插入顺序（帧号升序，再按源行升序）。
 * 中间未被任何帧覆盖的行对应空列表。
 */
public class ContributionMap {
    private final List<List<Contribution>> rows = new ArrayList<>();
    private int size;

    public void add(int absoluteRow, Contribution contribution) {
        if (absoluteRow < 0) {
            throw new IllegalArgumentException("Absolute row must be non-negative: " + absoluteRow);
        }
        while (rows.size() <= absoluteRow) {
            rows.add(new ArrayList<>(2));
        }
        rows.get(absoluteRow).add(contribution);
        size++;
    }

    /**
     * 输出高度 = 最大行号 + 1
     */
    public int rowCount() {
        return rows.size();
    }

    public List<Contribution> get(int absoluteRow) {
        if (absoluteRow < 0 || absoluteRow >= rows.size()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(rows.get(absoluteRow));
    }

    /**
     * 所有来源条目的总数（应等于各帧高度之和）
     */
    public int contributionCount() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
