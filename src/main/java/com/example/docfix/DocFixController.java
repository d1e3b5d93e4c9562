package com.example.docfix;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocFixController {

    static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final DocumentFlowService flow;
    private final UsageLimiter usageLimiter;

    @GetMapping("/")
    public String home() {
        return "DocFix is running!";
    }

    // 会话
    @PostMapping("/sessions/{userId}")
    public SessionView start(@PathVariable long userId,
                             @RequestParam(value = "mode", required = false, defaultValue = "EDIT") SessionMode mode,
                             @RequestParam(value = "channel", required = false) String channel) {
        return flow.start(userId, mode, channel);
    }

    @GetMapping("/sessions/{userId}")
    public SessionView view(@PathVariable long userId) {
        return flow.view(userId);
    }

    @PostMapping("/sessions/{userId}/keep-alive")
    public Map<String, Long> keepAlive(@PathVariable long userId) {
        return Map.of("timeout_remaining", flow.keepAlive(userId));
    }

    @DeleteMapping("/sessions/{userId}")
    public ResponseEntity<Void> cancel(@PathVariable long userId) {
        flow.cancel(userId);
        return ResponseEntity.noContent().build();
    }

    // 文档
    @PostMapping(value = "/sessions/{userId}/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SessionView upload(@PathVariable long userId, @RequestParam("file") MultipartFile file) throws IOException {
        log.info("upload from user {}: {} ({} bytes)", userId, file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return flow.attach(userId, file.getOriginalFilename(), in);
        }
    }

    @GetMapping("/sessions/{userId}/document")
    public ResponseEntity<byte[]> download(@PathVariable long userId) {
        DownloadedDocument doc = flow.download(userId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(doc.fileName(), StandardCharsets.UTF_8).build().toString())
                .contentType(DOCX)
                .body(doc.content());
    }

    @GetMapping("/sessions/{userId}/occurrences")
    public List<Occurrence> find(@PathVariable long userId, @RequestParam("search") String search) {
        return flow.find(userId, search);
    }

    @PostMapping("/sessions/{userId}/replace")
    public CompletableFuture<ReplaceResult> replace(@PathVariable long userId, @RequestBody Fix request) {
        return flow.replaceAll(userId, request.search(), request.replace());
    }

    @GetMapping("/sessions/{userId}/text")
    public AnalysisText analyze(@PathVariable long userId) {
        return flow.analyze(userId);
    }

    // 修正
    @PutMapping("/sessions/{userId}/fixes")
    public Map<String, Integer> submitFixes(@PathVariable long userId, @RequestBody List<Fix> fixes) {
        return Map.of("pending", flow.submitFixes(userId, fixes));
    }

    @PostMapping("/sessions/{userId}/fixes/apply")
    public CompletableFuture<FixReport> applyFixes(@PathVariable long userId) {
        return flow.applyPendingFixes(userId);
    }

    @PostMapping("/sessions/{userId}/fixes/review")
    public CompletableFuture<ReviewStep> review(@PathVariable long userId,
                                                @RequestParam(value = "accept", required = false) Boolean accept) {
        return flow.review(userId, accept);
    }

    // 额度
    @GetMapping("/usage/{userId}")
    public Map<String, Object> usage(@PathVariable long userId) {
        UsageStats stats = usageLimiter.usage(userId);
        UsageCheck check = usageLimiter.canUse(userId);
        return Map.of(
                "used", stats.used(),
                "limit", stats.limit(),
                "remaining", check.remaining(),
                "status", check.status(),
                "next_expiry", usageLimiter.nextExpiry(userId).map(Object::toString).orElse(""));
    }

    @PostMapping("/usage/{userId}")
    public Map<String, Object> recordUse(@PathVariable long userId) {
        UsageCheck slot = usageLimiter.tryAcquire(userId);
        if (!slot.allowed()) {
            throw new UsageLimitExceededException(userId, usageLimiter.usage(userId).limit(),
                    usageLimiter.nextExpiry(userId).orElse(null));
        }
        return Map.of("remaining", slot.remaining(), "status", slot.status());
    }
}
