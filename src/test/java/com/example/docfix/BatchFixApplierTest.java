package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchFixApplierTest {

    @Test
    @DisplayName("applied 与 skipped 恰好划分输入")
    void outcomePartitionsInput() throws Exception {
        try (XWPFDocument doc = new XWPFDocument()) {
            DocxFixtures.paragraph(doc, "Teh quick brown fox jumpd over.");
            Fix teh = new Fix("Teh", "The");
            Fix missing = new Fix("lazy dog", "sleepy dog");
            Fix jumpd = new Fix("jumpd", "jumped");

            BatchOutcome outcome = BatchFixApplier.applyAll(doc, List.of(teh, missing, jumpd));

            assertThat(outcome.applied()).containsExactly(teh, jumpd);
            assertThat(outcome.skipped()).extracting(SkippedFix::fix).containsExactly(missing);
            assertThat(outcome.skipped()).extracting(SkippedFix::reason).containsExactly(SkippedFix.Reason.NOT_FOUND);
            assertThat(outcome.appliedCount() + outcome.skippedCount()).isEqualTo(3);
            assertThat(outcome.replacements()).isEqualTo(2);
            assertThat(DocxTextModel.text(doc.getParagraphs().get(0))).isEqualTo("The quick brown fox jumped over.");
        }
    }

    @Test
    @DisplayName("格式错误的修正被跳过且不改动文档")
    void malformedFixesAreSkipped() throws Exception {
        try (XWPFDocument doc = new XWPFDocument()) {
            DocxFixtures.paragraph(doc, "same text");
            List<Fix> fixes = new ArrayList<>();
            fixes.add(new Fix("", "x"));
            fixes.add(new Fix("same", "same"));
            fixes.add(null);

            BatchOutcome outcome = BatchFixApplier.applyAll(doc, fixes);

            assertThat(outcome.applied()).isEmpty();
            assertThat(outcome.skipped()).extracting(SkippedFix::reason)
                    .containsOnly(SkippedFix.Reason.MALFORMED);
            assertThat(outcome.skippedCount()).isEqualTo(3);
            assertThat(outcome.changed()).isFalse();
            assertThat(DocxTextModel.text(doc.getParagraphs().get(0))).isEqualTo("same text");
        }
    }

    @Test
    @DisplayName("空列表不做任何事")
    void emptyInput() throws Exception {
        try (XWPFDocument doc = new XWPFDocument()) {
            DocxFixtures.paragraph(doc, "text");

            BatchOutcome outcome = BatchFixApplier.applyAll(doc, List.of());

            assertThat(outcome.appliedCount()).isZero();
            assertThat(outcome.skippedCount()).isZero();
            assertThat(outcome.changed()).isFalse();
        }
    }

    @Test
    @DisplayName("后面的修正作用在前面修正的结果上")
    void fixesApplyInOrder() throws Exception {
        try (XWPFDocument doc = new XWPFDocument()) {
            DocxFixtures.paragraph(doc, "colour");

            BatchOutcome outcome = BatchFixApplier.applyAll(doc,
                    List.of(new Fix("colour", "color"), new Fix("color", "hue")));

            assertThat(outcome.appliedCount()).isEqualTo(2);
            assertThat(DocxTextModel.text(doc.getParagraphs().get(0))).isEqualTo("hue");
        }
    }
}
