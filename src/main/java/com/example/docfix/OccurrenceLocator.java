package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** 按容器遍历顺序查找匹配，并附上所在整句作为上下文。纯读，不修改文档。 */
public final class OccurrenceLocator {
    private OccurrenceLocator() {}

    // 句末标点（. ! ?）后跟空白即为句子边界
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    public static List<Occurrence> locate(XWPFDocument doc, String search) {
        List<Occurrence> out = new ArrayList<>();
        if (search == null || search.isEmpty()) return out;

        List<XWPFParagraph> containers = DocxTextModel.containers(doc);
        int next = 0;
        for (int c = 0; c < containers.size(); c++) {
            String text = DocxTextModel.text(containers.get(c));
            if (!text.contains(search)) continue;

            for (String sentence : splitSentences(text)) {
                int n = RunSubstitution.countOccurrences(sentence, search);
                if (n == 0) continue;
                String trimmed = sentence.trim();
                for (int i = 0; i < n; i++) {
                    out.add(new Occurrence(next++, trimmed, c));
                }
            }
        }
        return out;
    }

    public static int count(XWPFDocument doc, String search) {
        if (search == null || search.isEmpty()) return 0;
        int total = 0;
        for (XWPFParagraph p : DocxTextModel.containers(doc)) {
            total += RunSubstitution.countOccurrences(DocxTextModel.text(p), search);
        }
        return total;
    }

    static String[] splitSentences(String text) {
        return SENTENCE_BREAK.split(text);
    }
}
