package com.example.docfix;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentFlowServiceTest {

    private static final long USER = 100L;

    @TempDir
    Path dir;

    private MutableClock clock;
    private ArtifactStorage storage;
    private SessionManager sessions;
    private UsageLimiter usage;
    private ExecutorService executor;
    private DocumentFlowService flow;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        storage = new ArtifactStorage(dir.toString());
        sessions = new SessionManager(
                new SessionTimeouts(Duration.ofMinutes(5), Duration.ofMinutes(7), Duration.ofMinutes(10)),
                clock, storage);
        usage = new UsageLimiter(new UsageLimits(2, 1, Duration.ofDays(7)), clock);
        executor = Executors.newFixedThreadPool(2);
        flow = flowWith(new DocxEditService());
    }

    private DocumentFlowService flowWith(DocxEditService edits) {
        return new DocumentFlowService(sessions, edits, new DocxValidator(10, List.of(".docx")),
                storage, usage, new UserLocks(8), executor);
    }

    /** 应用修正后停在 release 上，直到测试放行 */
    private static DocxEditService pausingAfterApply(CountDownLatch started, CountDownLatch release) {
        return new DocxEditService() {
            @Override
            public FixReport applyFixes(Path file, List<Fix> fixes) {
                FixReport report = super.applyFixes(file, fixes);
                started.countDown();
                try {
                    if (!release.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("release timed out");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return report;
            }
        };
    }

    private List<Path> filesOnDisk() throws Exception {
        try (var files = Files.list(dir)) {
            return files.toList();
        }
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static InputStream docx(String... paragraphs) throws Exception {
        try (XWPFDocument doc = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String p : paragraphs) DocxFixtures.paragraph(doc, p);
            doc.write(out);
            return new ByteArrayInputStream(out.toByteArray());
        }
    }

    private void startWithDocument(String... paragraphs) throws Exception {
        flow.start(USER, SessionMode.EDIT, "chat");
        flow.attach(USER, "essay.docx", docx(paragraphs));
    }

    private String currentText() throws Exception {
        Path file = sessions.getFilePath(USER).orElseThrow();
        try (XWPFDocument doc = DocxFixtures.open(file)) {
            return DocxTextModel.fullText(doc);
        }
    }

    @Test
    @DisplayName("没有会话时操作报 SessionNotFound")
    void requiresSession() {
        assertThatThrownBy(() -> flow.view(USER)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> flow.keepAlive(USER)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> flow.attach(USER, "a.docx", docx("x"))).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("没有文档时查找报 NoDocument")
    void requiresDocument() {
        flow.start(USER, SessionMode.EDIT, null);

        assertThatThrownBy(() -> flow.find(USER, "x")).isInstanceOf(NoDocumentException.class);
        assertThatThrownBy(() -> flow.applyPendingFixes(USER).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(NoDocumentException.class);
    }

    @Test
    @DisplayName("上传无效文件被拒绝且不留下文件")
    void invalidUploadIsRejected() throws Exception {
        flow.start(USER, SessionMode.EDIT, "chat");

        assertThatThrownBy(() -> flow.attach(USER, "essay.docx",
                new ByteArrayInputStream("garbage".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("Invalid or corrupted DOCX file.");
        assertThat(sessions.hasFile(USER)).isFalse();
        try (var files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("查找、替换后会话指向新文件，旧文件被删除")
    void findAndReplace() throws Exception {
        startWithDocument("Teh cat. Teh dog.");
        Path uploaded = sessions.getFilePath(USER).orElseThrow();

        assertThat(flow.find(USER, "Teh")).hasSize(2);
        assertThat(sessions.get(USER).orElseThrow().getFindText()).isEqualTo("Teh");

        ReplaceResult result = flow.replaceAll(USER, "Teh", "The").join();

        assertThat(result.replacements()).isEqualTo(2);
        assertThat(sessions.getFilePath(USER)).contains(result.artifact());
        assertThat(uploaded).doesNotExist();
        assertThat(currentText()).isEqualTo("The cat. The dog.");
    }

    @Test
    @DisplayName("提交修正只保留格式正确的，应用后清空待处理列表")
    void submitAndApplyFixes() throws Exception {
        startWithDocument("Teh quick fox jumpd.");

        int kept = flow.submitFixes(USER, List.of(
                new Fix("Teh", "The"), new Fix("", "x"), new Fix("jumpd", "jumped"), new Fix("same", "same")));
        FixReport report = flow.applyPendingFixes(USER).join();

        assertThat(kept).isEqualTo(2);
        assertThat(report.appliedCount()).isEqualTo(2);
        assertThat(currentText()).isEqualTo("The quick fox jumped.");
        assertThat(sessions.get(USER).orElseThrow().getPendingFixes()).isEmpty();
        assertThat(sessions.get(USER).orElseThrow().getMode()).isEqualTo(SessionMode.FIX);
    }

    @Test
    @DisplayName("逐条审阅：只应用接受的修正")
    void stepReview() throws Exception {
        startWithDocument("Teh quick fox jumpd.");
        flow.submitFixes(USER, List.of(new Fix("Teh", "The"), new Fix("jumpd", "jumped")));

        ReviewStep first = flow.review(USER, null).join();
        assertThat(first.done()).isFalse();
        assertThat(first.next()).isEqualTo(new Fix("Teh", "The"));

        ReviewStep second = flow.review(USER, true).join();
        assertThat(second.position()).isEqualTo(1);
        assertThat(second.next()).isEqualTo(new Fix("jumpd", "jumped"));

        ReviewStep last = flow.review(USER, false).join();
        assertThat(last.done()).isTrue();
        assertThat(last.report().appliedCount()).isEqualTo(1);
        assertThat(last.rejected()).containsExactly(new Fix("jumpd", "jumped"));
        assertThat(currentText()).isEqualTo("The quick fox jumpd.");
    }

    @Test
    @DisplayName("审阅全部跳过时文档不变")
    void reviewRejectAll() throws Exception {
        startWithDocument("Teh fox.");
        Path before = sessions.getFilePath(USER).orElseThrow();
        flow.submitFixes(USER, List.of(new Fix("Teh", "The")));

        ReviewStep last = flow.review(USER, false).join();

        assertThat(last.done()).isTrue();
        assertThat(last.report()).isNull();
        assertThat(sessions.getFilePath(USER)).contains(before);
    }

    @Test
    @DisplayName("没有待审阅的修正")
    void reviewWithoutFixes() throws Exception {
        startWithDocument("text");

        assertThatThrownBy(() -> flow.review(USER, true).join())
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("下载返回 _revisi 文件名并结束会话")
    void downloadEndsSession() throws Exception {
        startWithDocument("hello");
        Path file = sessions.getFilePath(USER).orElseThrow();

        DownloadedDocument doc = flow.download(USER);

        assertThat(doc.fileName()).isEqualTo("essay_revisi.docx");
        assertThat(doc.content()).isNotEmpty();
        assertThat(sessions.isActive(USER)).isFalse();
        assertThat(file).doesNotExist();
    }

    @Test
    @DisplayName("取消会话可重复调用")
    void cancelIsIdempotent() throws Exception {
        startWithDocument("hello");

        flow.cancel(USER);
        flow.cancel(USER);

        assertThat(sessions.isActive(USER)).isFalse();
    }

    @Test
    @DisplayName("分析消耗额度，用完后拒绝")
    void analyzeConsumesUsage() throws Exception {
        startWithDocument("Some text.");

        AnalysisText first = flow.analyze(USER);
        assertThat(first.text()).isEqualTo("Some text.");
        assertThat(first.remaining()).isEqualTo(1);
        assertThat(first.status()).isEqualTo(UsageStatus.LIMIT_WARNING);

        flow.analyze(USER);
        assertThatThrownBy(() -> flow.analyze(USER)).isInstanceOf(UsageLimitExceededException.class);
    }

    @Test
    @DisplayName("保活刷新剩余时间")
    void keepAliveRefreshesTimeout() throws Exception {
        startWithDocument("x");
        clock.advance(Duration.ofMinutes(4));
        assertThat(flow.view(USER).timeoutRemaining()).isEqualTo(360);

        assertThat(flow.keepAlive(USER)).isEqualTo(600);
    }

    @Test
    @DisplayName("并发分析不超出额度")
    void concurrentAnalyzeRespectsLimit() throws Exception {
        startWithDocument("Some text.");
        int threads = 16;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger served = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(callers.submit(() -> {
                    gate.await();
                    try {
                        flow.analyze(USER);
                        served.incrementAndGet();
                    } catch (UsageLimitExceededException e) {
                        refused.incrementAndGet();
                    }
                    return null;
                }));
            }
            gate.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(served.get()).isEqualTo(2);
        assertThat(refused.get()).isEqualTo(threads - 2);
        assertThat(usage.usage(USER).used()).isEqualTo(2);
    }

    @Test
    @DisplayName("文档无法读取时分析报错且不消耗额度")
    void unreadableDocumentDoesNotConsumeUsage() throws Exception {
        startWithDocument("Some text.");
        Path file = sessions.getFilePath(USER).orElseThrow();
        Files.write(file, "garbage".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> flow.analyze(USER)).isInstanceOf(DocumentUnreadableException.class);

        assertThat(usage.usage(USER).used()).isZero();
        assertThat(sessions.get(USER).orElseThrow().getMode()).isEqualTo(SessionMode.EDIT);
    }

    @Test
    @DisplayName("应用修正期间会话被超时清理，新产物随之删除")
    void sessionExpiredDuringApplyLeavesNoArtifact() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DocumentFlowService paused = flowWith(pausingAfterApply(started, release));
        paused.start(USER, SessionMode.EDIT, "chat");
        paused.attach(USER, "essay.docx", docx("Teh fox."));
        paused.submitFixes(USER, List.of(new Fix("Teh", "The")));

        CompletableFuture<FixReport> applying = paused.applyPendingFixes(USER);
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        sessions.cleanup(USER);
        release.countDown();

        FixReport report = applying.get(10, TimeUnit.SECONDS);
        assertThat(report.appliedCount()).isEqualTo(1);
        assertThat(sessions.isActive(USER)).isFalse();
        assertThat(filesOnDisk()).isEmpty();
    }

    @Test
    @DisplayName("取消会话等待进行中的修改结束，不留下任何文件")
    void cancelWaitsForRunningApply() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DocumentFlowService paused = flowWith(pausingAfterApply(started, release));
        paused.start(USER, SessionMode.EDIT, "chat");
        paused.attach(USER, "essay.docx", docx("Teh fox."));
        paused.submitFixes(USER, List.of(new Fix("Teh", "The")));

        CompletableFuture<FixReport> applying = paused.applyPendingFixes(USER);
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Void> cancelling = CompletableFuture.runAsync(() -> paused.cancel(USER));

        assertThatThrownBy(() -> cancelling.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        assertThat(sessions.isActive(USER)).isTrue();

        release.countDown();
        applying.get(10, TimeUnit.SECONDS);
        cancelling.get(10, TimeUnit.SECONDS);

        assertThat(sessions.isActive(USER)).isFalse();
        assertThat(filesOnDisk()).isEmpty();
    }
}
