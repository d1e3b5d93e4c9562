package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.ArrayList;
import java.util.List;

/**
 * 在内存文档上按顺序应用一组修正。每条修正都会尝试（不提前终止）；
 * 只要有一个容器发生替换即记为 applied，否则 skipped(NOT_FOUND)。
 * 格式错误的修正直接 skipped(MALFORMED)，不触碰文档。
 */
@Slf4j
public final class BatchFixApplier {
    private BatchFixApplier() {}

    public static BatchOutcome applyAll(XWPFDocument doc, List<Fix> fixes) {
        List<Fix> applied = new ArrayList<>();
        List<SkippedFix> skipped = new ArrayList<>();
        if (fixes == null || fixes.isEmpty()) return new BatchOutcome(applied, skipped, 0);

        // 容器序列只计算一次；替换不会增删段落
        List<XWPFParagraph> containers = DocxTextModel.containers(doc);
        int replacements = 0;

        for (int i = 0; i < fixes.size(); i++) {
            Fix fix = fixes.get(i);
            if (fix == null || !fix.isWellFormed()) {
                skipped.add(new SkippedFix(fix, SkippedFix.Reason.MALFORMED));
                log.debug("fix[{}] skipped: malformed {}", i, fix);
                continue;
            }

            int n = 0;
            for (XWPFParagraph p : containers) {
                n += RunSubstitution.substitute(p, fix.search(), fix.replace());
            }
            if (n > 0) {
                applied.add(fix);
                replacements += n;
            } else {
                skipped.add(new SkippedFix(fix, SkippedFix.Reason.NOT_FOUND));
                log.debug("fix[{}] skipped: \"{}\" not found", i, preview(fix.search()));
            }
        }
        return new BatchOutcome(applied, skipped, replacements);
    }

    private static String preview(String s) {
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
