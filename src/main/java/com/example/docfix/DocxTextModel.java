package com.example.docfix;

import org.apache.poi.xwpf.model.XWPFHeaderFooterPolicy;
import org.apache.poi.xwpf.usermodel.*;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBody;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;

import java.util.*;

/**
 * 把 docx 展平成有序的段落容器序列：正文段落 → 表格单元格段落（行优先）→
 * 各节的页眉/页脚（默认、首页、偶数页）。查找与替换共用同一顺序，
 * 因此同一文档快照上的 Occurrence 序号是确定的。
 */
public final class DocxTextModel {
    private DocxTextModel() {}

    public static List<XWPFParagraph> containers(XWPFDocument doc) {
        List<XWPFParagraph> out = new ArrayList<>(doc.getParagraphs());

        for (XWPFTable t : doc.getTables()) collectTable(t, out);

        Set<XWPFHeaderFooter> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CTSectPr sectPr : sections(doc)) {
            XWPFHeaderFooterPolicy policy = new XWPFHeaderFooterPolicy(doc, sectPr);
            collectPart(policy.getDefaultHeader(), seen, out);
            collectPart(policy.getDefaultFooter(), seen, out);
            collectPart(policy.getFirstPageHeader(), seen, out);
            collectPart(policy.getFirstPageFooter(), seen, out);
            collectPart(policy.getEvenPageHeader(), seen, out);
            collectPart(policy.getEvenPageFooter(), seen, out);
        }
        return out;
    }

    /** 段落纯文本 = 各 run 文本按序拼接 */
    public static String text(XWPFParagraph p) {
        StringBuilder sb = new StringBuilder();
        for (XWPFRun r : p.getRuns()) sb.append(RunText.read(r));
        return sb.toString();
    }

    /** 供外部分析使用的全文导出：正文、表格行（" | " 连接）、[HEADER]/[FOOTER] 行 */
    public static String fullText(XWPFDocument doc) {
        List<String> lines = new ArrayList<>();
        for (XWPFParagraph p : doc.getParagraphs()) {
            String s = text(p);
            if (notBlank(s)) lines.add(s);
        }
        for (XWPFTable t : doc.getTables()) {
            for (XWPFTableRow row : t.getRows()) {
                StringJoiner cells = new StringJoiner(" | ");
                for (XWPFTableCell cell : row.getTableCells()) {
                    StringJoiner cellText = new StringJoiner("\n");
                    for (XWPFParagraph p : cell.getParagraphs()) cellText.add(text(p));
                    String s = cellText.toString().trim();
                    if (!s.isEmpty()) cells.add(s);
                }
                if (cells.length() > 0) lines.add(cells.toString());
            }
        }
        Set<XWPFHeaderFooter> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CTSectPr sectPr : sections(doc)) {
            XWPFHeaderFooterPolicy policy = new XWPFHeaderFooterPolicy(doc, sectPr);
            appendTagged(policy.getDefaultHeader(), "[HEADER] ", seen, lines);
            appendTagged(policy.getDefaultFooter(), "[FOOTER] ", seen, lines);
        }
        return String.join("\n", lines);
    }

    /** 节顺序：段落级 w:sectPr 依次出现，最后是 body 级 w:sectPr */
    static List<CTSectPr> sections(XWPFDocument doc) {
        List<CTSectPr> out = new ArrayList<>();
        for (XWPFParagraph p : doc.getParagraphs()) {
            CTPPr ppr = p.getCTP().getPPr();
            if (ppr != null && ppr.isSetSectPr()) out.add(ppr.getSectPr());
        }
        CTBody body = doc.getDocument().getBody();
        if (body != null && body.isSetSectPr()) out.add(body.getSectPr());
        return out;
    }

    private static void collectTable(XWPFTable t, List<XWPFParagraph> out) {
        for (XWPFTableRow row : t.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                out.addAll(cell.getParagraphs());
                for (XWPFTable nested : cell.getTables()) collectTable(nested, out);
            }
        }
    }

    private static void collectPart(XWPFHeaderFooter part, Set<XWPFHeaderFooter> seen, List<XWPFParagraph> out) {
        if (part == null || !seen.add(part)) return;
        out.addAll(part.getParagraphs());
        for (XWPFTable t : part.getTables()) collectTable(t, out);
    }

    private static void appendTagged(XWPFHeaderFooter part, String tag, Set<XWPFHeaderFooter> seen, List<String> lines) {
        if (part == null || !seen.add(part)) return;
        for (XWPFParagraph p : part.getParagraphs()) {
            String s = text(p);
            if (notBlank(s)) lines.add(tag + s);
        }
    }

    private static boolean notBlank(String s) { return s != null && !s.trim().isEmpty(); }
}
