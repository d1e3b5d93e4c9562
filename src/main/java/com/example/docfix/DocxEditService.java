package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * 文件级的查找、替换与批量修正。每次操作都重新打开文档；只有确实发生替换时
 * 才写出新文件 {base}_revisi{ext}，原文件保持不变。
 * 读写失败在此处捕获并记录，返回“无变化”的结果（status = FAILED）。
 */
@Slf4j
@Service
public class DocxEditService {

    static final String REVISED_SUFFIX = "_revisi";

    public List<Occurrence> locate(Path file, String search) {
        try (XWPFDocument doc = open(file)) {
            return OccurrenceLocator.locate(doc, search);
        } catch (IOException | RuntimeException e) {
            log.error("locate failed on {}: {}", file, e.getMessage(), e);
            return List.of();
        }
    }

    public int count(Path file, String search) {
        try (XWPFDocument doc = open(file)) {
            return OccurrenceLocator.count(doc, search);
        } catch (IOException | RuntimeException e) {
            log.error("count failed on {}: {}", file, e.getMessage(), e);
            return 0;
        }
    }

    /** 读取失败时为空，与“文档没有文本”（空串）区分开 */
    public Optional<String> readFullText(Path file) {
        try (XWPFDocument doc = open(file)) {
            return Optional.of(DocxTextModel.fullText(doc));
        } catch (IOException | RuntimeException e) {
            log.error("read failed on {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /** 全文替换一对文本；无匹配时不生成文件 */
    public ReplaceResult replaceText(Path file, String search, String replace) {
        if (search == null || search.isEmpty()) return ReplaceResult.noChange();
        try (XWPFDocument doc = open(file)) {
            int total = 0;
            for (XWPFParagraph p : DocxTextModel.containers(doc)) {
                total += RunSubstitution.substitute(p, search, replace);
            }
            if (total == 0) return ReplaceResult.noChange();

            Path target = revisedPath(file);
            save(doc, target);
            log.info("replaced {} occurrence(s), saved to {}", total, target);
            return new ReplaceResult(target, total, EditStatus.CHANGED);
        } catch (IOException | RuntimeException e) {
            log.error("replace failed on {}: {}", file, e.getMessage(), e);
            return ReplaceResult.failed();
        }
    }

    /** 批量应用修正；全部在内存完成后才一次性落盘 */
    public FixReport applyFixes(Path file, List<Fix> fixes) {
        List<Fix> input = (fixes == null) ? List.of() : fixes;
        try (XWPFDocument doc = open(file)) {
            BatchOutcome outcome = BatchFixApplier.applyAll(doc, input);
            if (!outcome.changed()) {
                log.info("no fix applied ({} skipped), document unchanged", outcome.skippedCount());
                return FixReport.unchanged(outcome);
            }

            Path target = revisedPath(file);
            save(doc, target);
            log.info("applied {} fix(es), skipped {}, {} replacement(s), saved to {}",
                    outcome.appliedCount(), outcome.skippedCount(), outcome.replacements(), target);
            return FixReport.of(target, outcome);
        } catch (IOException | RuntimeException e) {
            log.error("applying {} fix(es) failed on {}: {}", input.size(), file, e.getMessage(), e);
            return FixReport.failed(input);
        }
    }

    static Path revisedPath(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String revised = (dot > 0)
                ? name.substring(0, dot) + REVISED_SUFFIX + name.substring(dot)
                : name + REVISED_SUFFIX;
        return file.resolveSibling(revised);
    }

    private static XWPFDocument open(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new XWPFDocument(in);
        }
    }

    /** 先写同目录临时文件再移动，半成品不会出现在目标路径 */
    private static void save(XWPFDocument doc, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, ".docfix-", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                doc.write(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
