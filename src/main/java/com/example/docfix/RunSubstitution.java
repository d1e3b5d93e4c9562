package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.ArrayList;
import java.util.List;

/**
 * 段落内保留格式的子串替换。
 * <p>
 * 快路径：匹配完整落在单个 run 内时就地替换，run 边界和格式不动。
 * 跨 run 回退：拼接全部 run 文本后替换，结果整体写入第一个 run（沿用其格式），
 * 其余 run 删除；锚点 run（超链、域、脚注/批注引用、图片、嵌入对象、符号）只清空不删除。
 * 回退会让整段退化为第一个 run 的格式，这是已知的取舍。
 */
public final class RunSubstitution {
    private RunSubstitution() {}

    /** run 在拼接文本中的 [start, end) 区间 */
    public static final class RunSpan {
        public final int runIndex;
        public final int start;
        public final int end;

        RunSpan(int runIndex, int start, int end) {
            this.runIndex = runIndex; this.start = start; this.end = end;
        }

        boolean covers(int from, int to) { return from >= start && to <= end; }
    }

    public static int substitute(XWPFParagraph p, String search, String replace) {
        if (search == null || search.isEmpty()) return 0;
        String full = DocxTextModel.text(p);
        if (!full.contains(search)) return 0;

        if (allMatchesInsideRuns(spans(p), full, search)) {
            return replaceWithinRuns(p, search, replace);
        }
        // 至少一处匹配跨越 run 边界：整段走回退，保证一次处理完所有匹配
        return replaceAcrossRuns(p, search, replace);
    }

    /** 快路径：逐 run 就地替换，返回替换次数 */
    public static int replaceWithinRuns(XWPFParagraph p, String search, String replace) {
        if (search == null || search.isEmpty()) return 0;
        String repl = (replace == null) ? "" : replace;
        int count = 0;
        for (XWPFRun r : p.getRuns()) {
            String txt = RunText.read(r);
            int n = countOccurrences(txt, search);
            if (n == 0) continue;
            RunText.write(r, txt.replace(search, repl));
            count += n;
        }
        return count;
    }

    /** 跨 run 回退：整段拼接替换，首个 run 承载全部新文本 */
    public static int replaceAcrossRuns(XWPFParagraph p, String search, String replace) {
        if (search == null || search.isEmpty()) return 0;
        List<XWPFRun> runs = p.getRuns();
        if (runs.isEmpty()) return 0;

        StringBuilder combined = new StringBuilder();
        for (XWPFRun r : runs) combined.append(RunText.read(r));
        String before = combined.toString();
        String after = before.replace(search, (replace == null) ? "" : replace);
        if (after.equals(before)) return 0;

        RunText.write(runs.get(0), after);
        for (int i = runs.size() - 1; i >= 1; i--) {
            XWPFRun r = p.getRuns().get(i);
            if (RunText.isAnchored(r)) RunText.clear(r);
            else p.removeRun(i);
        }
        return countOccurrences(before, search);
    }

    public static List<RunSpan> spans(XWPFParagraph p) {
        List<RunSpan> out = new ArrayList<>();
        int pos = 0;
        List<XWPFRun> runs = p.getRuns();
        for (int i = 0; i < runs.size(); i++) {
            int len = RunText.read(runs.get(i)).length();
            out.add(new RunSpan(i, pos, pos + len));
            pos += len;
        }
        return out;
    }

    /** 不重叠、从左到右计数（与 String.replace 的匹配方式一致） */
    public static int countOccurrences(String text, String search) {
        if (text == null || search == null || search.isEmpty()) return 0;
        int count = 0;
        int from = 0;
        while (true) {
            int idx = text.indexOf(search, from);
            if (idx < 0) return count;
            count++;
            from = idx + search.length();
        }
    }

    private static boolean allMatchesInsideRuns(List<RunSpan> spans, String full, String search) {
        int from = 0;
        while (true) {
            int idx = full.indexOf(search, from);
            if (idx < 0) return true;
            int end = idx + search.length();
            boolean inside = false;
            for (RunSpan s : spans) {
                if (s.covers(idx, end)) { inside = true; break; }
            }
            if (!inside) return false;
            from = end;
        }
    }
}
