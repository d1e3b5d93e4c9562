package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * 会话与文档引擎之间的编排：上传、查找、替换、提交/应用/逐条审阅修正、下载。
 * 修改文档的操作在编辑线程池上执行，同一用户的修改通过 {@link UserLocks} 串行。
 */
@Slf4j
@Service
public class DocumentFlowService {

    private final SessionManager sessions;
    private final DocxEditService edits;
    private final DocxValidator validator;
    private final ArtifactStorage storage;
    private final UsageLimiter usageLimiter;
    private final UserLocks locks;
    private final ExecutorService editExecutor;

    public DocumentFlowService(SessionManager sessions,
                               DocxEditService edits,
                               DocxValidator validator,
                               ArtifactStorage storage,
                               UsageLimiter usageLimiter,
                               UserLocks locks,
                               @Qualifier("editExecutor") ExecutorService editExecutor) {
        this.sessions = sessions;
        this.edits = edits;
        this.validator = validator;
        this.storage = storage;
        this.usageLimiter = usageLimiter;
        this.locks = locks;
        this.editExecutor = editExecutor;
    }

    public SessionView start(long userId, SessionMode mode, String channel) {
        Session s = sessions.create(userId, mode == null ? SessionMode.EDIT : mode, channel);
        return SessionView.of(s, sessions.timeoutRemaining(userId));
    }

    public SessionView view(long userId) {
        Session s = sessions.get(userId).orElseThrow(() -> new SessionNotFoundException(userId));
        return SessionView.of(s, sessions.timeoutRemaining(userId));
    }

    /** 刷新活动时间，返回新的剩余秒数 */
    public long keepAlive(long userId) {
        requireSession(userId);
        sessions.updateActivity(userId);
        return sessions.timeoutRemaining(userId);
    }

    /** 保存并校验上传文件；校验失败时删除已落盘的文件 */
    public SessionView attach(long userId, String originalName, InputStream content) throws IOException {
        requireSession(userId);
        Path stored = storage.store(userId, originalName, content);

        ValidationResult check = validator.validate(stored);
        if (!check.valid()) {
            storage.delete(stored);
            log.warn("upload rejected for user {}: {}", userId, check.reason());
            throw new DocumentValidationException(check.reason());
        }

        String name = (originalName == null || originalName.isBlank()) ? ArtifactStorage.DEFAULT_NAME : originalName;
        return locks.withLock(userId, () -> {
            sessions.setFile(userId, stored, name);
            if (!sessions.isActive(userId)) storage.delete(stored);
            return view(userId);
        });
    }

    /** 查找匹配并记住本次查找文本与结果 */
    public List<Occurrence> find(long userId, String search) {
        if (search == null || search.isEmpty()) throw new IllegalArgumentException("search text must not be empty");
        return locks.withLock(userId, () -> {
            Path file = requireFile(userId);
            List<Occurrence> found = edits.locate(file, search);
            sessions.update(userId, s -> {
                s.setFindText(search);
                s.setOccurrences(new ArrayList<>(found));
            });
            log.info("user {} searched \"{}\": {} occurrence(s)", userId, search, found.size());
            return found;
        });
    }

    /** 分析入口：先占一次额度，再导出全文；读取失败时退回额度 */
    public AnalysisText analyze(long userId) {
        requireFile(userId);
        UsageCheck slot = usageLimiter.tryAcquire(userId);
        if (!slot.allowed()) {
            throw new UsageLimitExceededException(userId, usageLimiter.usage(userId).limit(),
                    usageLimiter.nextExpiry(userId).orElse(null));
        }

        Optional<String> text;
        try {
            text = locks.withLock(userId, () -> edits.readFullText(requireFile(userId)));
        } catch (RuntimeException e) {
            usageLimiter.refund(userId);
            throw e;
        }
        if (text.isEmpty()) {
            usageLimiter.refund(userId);
            throw new DocumentUnreadableException(userId);
        }

        sessions.update(userId, s -> s.setMode(SessionMode.ANALYZE));
        return new AnalysisText(text.get(), slot.remaining(), slot.status());
    }

    public CompletableFuture<ReplaceResult> replaceAll(long userId, String search, String replace) {
        if (search == null || search.isEmpty()) throw new IllegalArgumentException("search text must not be empty");
        return mutate(userId, () -> {
            Path file = requireFile(userId);
            ReplaceResult result = edits.replaceText(file, search, replace);
            result.artifactPath().ifPresent(p -> adopt(userId, p));
            sessions.update(userId, s -> {
                s.setFindText(search);
                s.setReplaceText(replace);
                s.setOccurrences(new ArrayList<>());
            });
            return result;
        });
    }

    /** 只保留格式正确的修正作为待处理列表，返回保留条数 */
    public int submitFixes(long userId, List<Fix> fixes) {
        List<Fix> accepted = new ArrayList<>();
        if (fixes != null) {
            for (Fix f : fixes) if (f != null && f.isWellFormed()) accepted.add(f);
        }
        requireFile(userId);
        sessions.update(userId, s -> {
            s.clearPending();
            s.setMode(SessionMode.FIX);
            s.setPendingFixes(accepted);
        });
        log.info("user {} submitted {} fix(es), {} kept", userId, fixes == null ? 0 : fixes.size(), accepted.size());
        return accepted.size();
    }

    public CompletableFuture<FixReport> applyPendingFixes(long userId) {
        return mutate(userId, () -> {
            Path file = requireFile(userId);
            List<Fix> pending = requireSession(userId).getPendingFixes();
            FixReport report = edits.applyFixes(file, pending);
            report.artifactPath().ifPresent(p -> adopt(userId, p));
            sessions.update(userId, Session::clearPending);
            return report;
        });
    }

    /**
     * 逐条审阅：accept 决定当前修正是否采用。全部审阅完后，把采用的修正作为一批应用。
     * accept 为空时只返回当前位置，不推进。
     */
    public CompletableFuture<ReviewStep> review(long userId, Boolean accept) {
        return mutate(userId, () -> {
            Session s = requireSession(userId);
            List<Fix> pending = s.getPendingFixes();
            if (pending.isEmpty()) throw new IllegalStateException("No fixes to review.");

            int index = s.getReviewIndex();
            if (accept != null && index < pending.size()) {
                Fix current = pending.get(index);
                int next = index + 1;
                sessions.update(userId, x -> {
                    if (accept) x.getReviewApplied().add(current);
                    else x.getReviewSkipped().add(current);
                    x.setReviewIndex(next);
                });
                index = next;
            }
            if (index < pending.size()) {
                return ReviewStep.pending(index, pending.size(), pending.get(index));
            }
            return finishReview(userId);
        });
    }

    /** 读取当前文件并结束会话 */
    public DownloadedDocument download(long userId) {
        return locks.withLock(userId, () -> {
            Path file = requireFile(userId);
            String name = ArtifactStorage.outputName(sessions.getOriginalName(userId).orElse(null));
            byte[] content;
            try {
                content = Files.readAllBytes(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            sessions.cleanup(userId);
            log.info("user {} downloaded {} ({} bytes)", userId, name, content.length);
            return new DownloadedDocument(name, content);
        });
    }

    /** 放弃会话及其文件；会话不存在时什么也不做 */
    public void cancel(long userId) {
        locks.withLock(userId, () -> {
            sessions.cleanup(userId);
            return null;
        });
    }

    private ReviewStep finishReview(long userId) {
        Session s = requireSession(userId);
        List<Fix> accepted = s.getReviewApplied();
        List<Fix> rejected = s.getReviewSkipped();
        int total = s.getPendingFixes().size();

        FixReport report = null;
        if (!accepted.isEmpty()) {
            report = edits.applyFixes(requireFile(userId), accepted);
            report.artifactPath().ifPresent(p -> adopt(userId, p));
        }
        sessions.update(userId, Session::clearPending);
        log.info("user {} finished review: {} accepted, {} rejected", userId, accepted.size(), rejected.size());
        return ReviewStep.finished(total, report, rejected);
    }

    // 会话在编辑期间被清理时，新产物无人引用，直接删除
    private void adopt(long userId, Path artifact) {
        if (!sessions.updateFile(userId, artifact)) {
            log.info("session of user {} ended during edit, discarding {}", userId, artifact.getFileName());
            storage.delete(artifact);
        }
    }

    private <T> CompletableFuture<T> mutate(long userId, Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> locks.withLock(userId, action), editExecutor);
    }

    private Session requireSession(long userId) {
        return sessions.get(userId).orElseThrow(() -> new SessionNotFoundException(userId));
    }

    private Path requireFile(long userId) {
        Session s = requireSession(userId);
        if (!s.hasFile()) throw new NoDocumentException(userId);
        return s.getFilePath();
    }
}
