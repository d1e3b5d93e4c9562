package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** 文档进入引擎前的校验：存在、扩展名、大小、能否作为 docx 打开。不修改任何状态。 */
@Slf4j
@Component
public class DocxValidator {

    private final long maxSizeBytes;
    private final List<String> allowedExtensions;

    public DocxValidator(@Value("${docfix.document.max-size-mb:10}") int maxSizeMb,
                         @Value("${docfix.document.allowed-extensions:.docx}") List<String> allowedExtensions) {
        this.maxSizeBytes = maxSizeMb * 1024L * 1024L;
        this.allowedExtensions = allowedExtensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public ValidationResult validate(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return ValidationResult.reject("File not found.");
        }

        String ext = extensionOf(file.getFileName().toString());
        if (!allowedExtensions.contains(ext)) {
            return ValidationResult.reject("Invalid file type. Supported: " + String.join(", ", allowedExtensions));
        }

        try {
            long size = Files.size(file);
            if (size > maxSizeBytes) {
                return ValidationResult.reject("File too large. Maximum size: " + (maxSizeBytes / (1024 * 1024)) + "MB");
            }
        } catch (IOException e) {
            return ValidationResult.reject("Cannot read file: " + e.getMessage());
        }

        try (InputStream in = Files.newInputStream(file);
             XWPFDocument doc = new XWPFDocument(in)) {
            doc.getParagraphs().size();
        } catch (IOException | RuntimeException e) {
            log.warn("rejected {}: {}", file.getFileName(), e.getMessage());
            return ValidationResult.reject("Invalid or corrupted DOCX file.");
        }
        return ValidationResult.ok();
    }

    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
