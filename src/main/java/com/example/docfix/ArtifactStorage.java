package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/** 用户上传文件的落盘、命名与删除 */
@Slf4j
@Component
public class ArtifactStorage {

    static final String DEFAULT_NAME = "document.docx";

    private final Path dir;

    public ArtifactStorage(@Value("${docfix.storage.dir:downloads}") String dir) throws IOException {
        this.dir = Paths.get(dir).toAbsolutePath();
        Files.createDirectories(this.dir);
    }

    public Path directory() { return dir; }

    /** 保存为 {uuid}_{清洗后的文件名}，避免重名与路径穿越 */
    public Path store(long userId, String originalName, InputStream content) throws IOException {
        Path target = dir.resolve(UUID.randomUUID() + "_" + sanitize(originalName));
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("stored upload for user {}: {}", userId, target.getFileName());
        return target;
    }

    /** 删除失败只记录，不抛出 */
    public boolean delete(Path file) {
        if (file == null) return false;
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) log.info("deleted file: {}", file);
            return deleted;
        } catch (IOException e) {
            log.error("failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }

    public static String sanitize(String filename) {
        if (filename == null) return DEFAULT_NAME;
        String s = filename.replace("/", "").replace("\\", "").replace("\0", "");

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            boolean ascii = ch < 128;
            if (ascii && (Character.isLetterOrDigit(ch) || "._- ".indexOf(ch) >= 0)) sb.append(ch);
            else if (!ascii && Character.isLetter(ch)) sb.append(ch);
        }
        String safe = sb.toString().trim();
        if (safe.isEmpty() || safe.startsWith(".")) safe = DEFAULT_NAME;
        if (!safe.toLowerCase(Locale.ROOT).endsWith(".docx")) safe += ".docx";
        return safe;
    }

    /** 回传给用户的文件名：{base}_revisi{ext} */
    public static String outputName(String originalName) {
        String name = (originalName == null || originalName.isBlank()) ? DEFAULT_NAME : originalName;
        int dot = name.lastIndexOf('.');
        return (dot > 0)
                ? name.substring(0, dot) + DocxEditService.REVISED_SUFFIX + name.substring(dot)
                : name + DocxEditService.REVISED_SUFFIX;
    }
}
