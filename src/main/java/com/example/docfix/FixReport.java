package com.example.docfix;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * applyFixes 的结果。artifact 仅在至少一条修正生效时存在；
 * appliedCount + skippedCount 恒等于输入条数。
 */
public record FixReport(
        @JsonIgnore Path artifact,
        int appliedCount,
        int skippedCount,
        List<Fix> applied,
        List<SkippedFix> skipped,
        EditStatus status
) {

    static FixReport of(Path artifact, BatchOutcome outcome) {
        return new FixReport(artifact, outcome.appliedCount(), outcome.skippedCount(),
                List.copyOf(outcome.applied()), List.copyOf(outcome.skipped()), EditStatus.CHANGED);
    }

    /** 没有任何修正生效：全部输入记为跳过，保留各自原因 */
    static FixReport unchanged(BatchOutcome outcome) {
        return new FixReport(null, 0, outcome.skippedCount(),
                List.of(), List.copyOf(outcome.skipped()), EditStatus.NO_CHANGE);
    }

    static FixReport failed(List<Fix> fixes) {
        List<SkippedFix> skipped = new ArrayList<>(fixes.size());
        for (Fix f : fixes) skipped.add(new SkippedFix(f, SkippedFix.Reason.ERROR));
        return new FixReport(null, 0, fixes.size(), List.of(), List.copyOf(skipped), EditStatus.FAILED);
    }

    public Optional<Path> artifactPath() { return Optional.ofNullable(artifact); }

    public List<Fix> skippedFixes() {
        List<Fix> out = new ArrayList<>(skipped.size());
        for (SkippedFix s : skipped) out.add(s.fix());
        return out;
    }
}
