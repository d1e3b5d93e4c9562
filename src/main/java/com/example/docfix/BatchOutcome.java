package com.example.docfix;

import java.util.List;

/** 内存中批量应用的结果；applied 与 skipped 按输入顺序划分全部修正 */
public record BatchOutcome(List<Fix> applied, List<SkippedFix> skipped, int replacements) {

    public int appliedCount() { return applied.size(); }

    public int skippedCount() { return skipped.size(); }

    public boolean changed() { return !applied.isEmpty(); }
}
