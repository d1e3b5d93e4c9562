package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFFieldRun;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;

import javax.xml.namespace.QName;

/** run 级可见文本的读写；写入只替换文本节点，保留 w:rPr 与其他子节点 */
public final class RunText {
    private RunText() {}

    private static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final QName QN_W_T   = new QName(NS_W, "t");
    private static final QName QN_W_BR  = new QName(NS_W, "br");
    private static final QName QN_W_TAB = new QName(NS_W, "tab");
    private static final QName QN_XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    private static final char SOFT_HYPHEN = (char) 0x00AD;
    private static final char NO_BREAK_HYPHEN = (char) 0x2011;
    private static final char LINE_SEP = (char) 0x2028;
    private static final char PARA_SEP = (char) 0x2029;

    /** t / tab / br / cr / 连字符；instrText 属于域代码，不算可见文本 */
    public static String read(XWPFRun r) {
        CTR ctr = r.getCTR();
        if (ctr == null) return "";
        StringBuilder sb = new StringBuilder();
        try (XmlCursor rc = ctr.newCursor()) {
            if (rc.toFirstChild()) {
                do {
                    QName n = rc.getName(); if (n == null) continue;
                    String ln = n.getLocalPart();
                    if ("t".equals(ln)) {
                        String v = rc.getTextValue(); if (v != null) sb.append(v);
                    } else if ("br".equals(ln) || "cr".equals(ln)) {
                        sb.append('\n');
                    } else if ("tab".equals(ln)) {
                        sb.append('\t');
                    } else if ("softHyphen".equals(ln)) {
                        sb.append(SOFT_HYPHEN);
                    } else if ("noBreakHyphen".equals(ln)) {
                        sb.append(NO_BREAK_HYPHEN);
                    }
                } while (rc.toNextSibling());
            }
        }
        return sb.toString();
    }

    /** 覆盖 run 文本：\n 写成 <w:br/>，\t 写成 <w:tab/>，其余进入 <w:t xml:space="preserve"> */
    public static void write(XWPFRun r, String text) {
        CTR ctr = r.getCTR();
        if (ctr == null) return;
        String s = (text == null) ? "" : text.replace("\r\n", "\n").replace('\r', '\n')
                                              .replace(LINE_SEP, '\n').replace(PARA_SEP, '\n');
        clear(r);
        StringBuilder chunk = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '\n' || ch == '\t') {
                appendText(ctr, chunk);
                appendEmpty(ctr, ch == '\n' ? QN_W_BR : QN_W_TAB);
            } else {
                chunk.append(ch);
            }
        }
        appendText(ctr, chunk);
    }

    /** 只删可见文本节点（t/br/cr/tab/连字符），格式与域结构保留 */
    public static void clear(XWPFRun r) {
        CTR ctr = r.getCTR();
        if (ctr == null) return;
        for (int i = ctr.sizeOfTArray() - 1; i >= 0; i--) ctr.removeT(i);
        for (int i = ctr.sizeOfBrArray() - 1; i >= 0; i--) ctr.removeBr(i);
        for (int i = ctr.sizeOfCrArray() - 1; i >= 0; i--) ctr.removeCr(i);
        for (int i = ctr.sizeOfTabArray() - 1; i >= 0; i--) ctr.removeTab(i);
        for (int i = ctr.sizeOfSoftHyphenArray() - 1; i >= 0; i--) ctr.removeSoftHyphen(i);
        for (int i = ctr.sizeOfNoBreakHyphenArray() - 1; i >= 0; i--) ctr.removeNoBreakHyphen(i);
    }

    /**
     * 含超链/域/脚注/批注引用，或图片、嵌入对象、符号的 run 视为锚点：折叠时只清空、不删除
     */
    public static boolean isAnchored(XWPFRun r) {
        if (r instanceof XWPFHyperlinkRun || r instanceof XWPFFieldRun) return true;
        CTR ctr = r.getCTR(); if (ctr == null) return false;
        if (ctr.sizeOfDrawingArray() > 0 || ctr.sizeOfPictArray() > 0) return true;
        if (ctr.sizeOfObjectArray() > 0 || ctr.sizeOfSymArray() > 0) return true;
        if (ctr.sizeOfFldCharArray() > 0) return true;
        if (ctr.sizeOfInstrTextArray() > 0) return true;
        if (ctr.sizeOfFootnoteReferenceArray() > 0) return true;
        if (ctr.sizeOfEndnoteReferenceArray() > 0) return true;
        return ctr.sizeOfCommentReferenceArray() > 0;
    }

    // 每次新开游标定位到 run 的结束标记前，保证追加顺序
    private static void appendText(CTR ctr, StringBuilder chunk) {
        if (chunk.length() == 0) return;
        try (XmlCursor c = ctr.newCursor()) {
            c.toEndToken();
            c.beginElement(QN_W_T);
            c.insertAttributeWithValue(QN_XML_SPACE, "preserve");
            c.insertChars(chunk.toString());
        }
        chunk.setLength(0);
    }

    private static void appendEmpty(CTR ctr, QName name) {
        try (XmlCursor c = ctr.newCursor()) {
            c.toEndToken();
            c.beginElement(name);
        }
    }
}
