package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocxTextModelTest {

    @Test
    @DisplayName("段落文本等于各 run 文本的拼接")
    void paragraphTextIsRunConcatenation() throws Exception {
        try (XWPFDocument doc = new XWPFDocument()) {
            XWPFParagraph p = DocxFixtures.paragraph(doc, "Teh ", "quick", " brown fox");

            assertThat(DocxTextModel.text(p)).isEqualTo("Teh quick brown fox");
        }
    }

    @Test
    @DisplayName("遍历顺序：正文 → 表格（行优先）→ 页眉 → 页脚")
    void containerOrder() throws Exception {
        XWPFDocument doc = new XWPFDocument();
        DocxFixtures.paragraph(doc, "body one");
        DocxFixtures.paragraph(doc, "body two");
        DocxFixtures.table(doc, new String[][]{{"r1c1", "r1c2"}, {"r2c1", "r2c2"}});
        DocxFixtures.header(doc, "page header");
        DocxFixtures.footer(doc, "page footer");

        try (XWPFDocument reloaded = DocxFixtures.reload(doc)) {
            List<String> texts = DocxTextModel.containers(reloaded).stream()
                    .map(DocxTextModel::text)
                    .filter(s -> !s.isEmpty())
                    .toList();

            assertThat(texts).containsExactly(
                    "body one", "body two",
                    "r1c1", "r1c2", "r2c1", "r2c2",
                    "page header", "page footer");
        }
    }

    @Test
    @DisplayName("同一文档多次遍历结果一致")
    void traversalIsDeterministic() throws Exception {
        XWPFDocument doc = new XWPFDocument();
        DocxFixtures.paragraph(doc, "a");
        DocxFixtures.table(doc, new String[][]{{"b", "c"}});
        DocxFixtures.header(doc, "d");

        try (XWPFDocument reloaded = DocxFixtures.reload(doc)) {
            List<XWPFParagraph> first = DocxTextModel.containers(reloaded);
            List<XWPFParagraph> second = DocxTextModel.containers(reloaded);
            assertThat(second).containsExactlyElementsOf(first);
        }
    }

    @Test
    @DisplayName("全文导出包含表格行与页眉页脚标记")
    void fullTextExport() throws Exception {
        XWPFDocument doc = new XWPFDocument();
        DocxFixtures.paragraph(doc, "Intro");
        DocxFixtures.paragraph(doc, "   ");
        DocxFixtures.table(doc, new String[][]{{"Name", "Value"}});
        DocxFixtures.header(doc, "Top");
        DocxFixtures.footer(doc, "Bottom");

        try (XWPFDocument reloaded = DocxFixtures.reload(doc)) {
            assertThat(DocxTextModel.fullText(reloaded))
                    .isEqualTo("Intro\nName | Value\n[HEADER] Top\n[FOOTER] Bottom");
        }
    }
}
