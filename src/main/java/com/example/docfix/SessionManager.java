package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 每个用户一个会话：当前文档、待处理修正与活动时间。
 * <p>
 * 任何字段更新都会刷新 lastActivity 并复位 warningSent。会话同一时刻最多引用一个文件，
 * 换文件时旧文件由这里删除。超时扫描只产出 (userId, channel) 列表，通知由调用方负责。
 * 所有读改写都在同一把锁内完成，请求线程与扫描线程可以并发调用。
 */
@Slf4j
@Component
public class SessionManager {

    private final Map<Long, Session> sessions = new HashMap<>();
    private final SessionTimeouts timeouts;
    private final Clock clock;
    private final ArtifactStorage storage;

    public SessionManager(SessionTimeouts timeouts, Clock clock, ArtifactStorage storage) {
        this.timeouts = timeouts;
        this.clock = clock;
        this.storage = storage;
    }

    /** 已有会话时先清理（连同其文件），再新建 */
    public synchronized Session create(long userId, SessionMode mode, String channel) {
        if (sessions.containsKey(userId)) cleanup(userId);
        Session s = new Session(userId, mode, channel, clock.instant());
        sessions.put(userId, s);
        log.info("session created for user {}, mode: {}", userId, mode);
        return s.copy();
    }

    public synchronized Optional<Session> get(long userId) {
        Session s = sessions.get(userId);
        return s == null ? Optional.empty() : Optional.of(s.copy());
    }

    /** 不存在的会话返回 false，不抛异常 */
    public synchronized boolean update(long userId, Consumer<Session> change) {
        Session s = sessions.get(userId);
        if (s == null) return false;
        change.accept(s);
        touch(s);
        return true;
    }

    public synchronized void updateActivity(long userId) {
        Session s = sessions.get(userId);
        if (s != null) touch(s);
    }

    public synchronized void setFile(long userId, Path file, String originalName) {
        Session s = sessions.get(userId);
        if (s == null) return;
        replaceFile(s, file);
        s.setOriginalName(originalName);
        touch(s);
        log.info("file set for user {}: {}", userId, originalName);
    }

    /** 编辑产生新文件后切换引用，旧文件随即删除；会话已不存在时返回 false */
    public synchronized boolean updateFile(long userId, Path newFile) {
        Session s = sessions.get(userId);
        if (s == null) return false;
        replaceFile(s, newFile);
        touch(s);
        return true;
    }

    public synchronized Optional<Path> getFilePath(long userId) {
        Session s = sessions.get(userId);
        return s == null ? Optional.empty() : Optional.ofNullable(s.getFilePath());
    }

    public synchronized Optional<String> getOriginalName(long userId) {
        Session s = sessions.get(userId);
        return s == null ? Optional.empty() : Optional.ofNullable(s.getOriginalName());
    }

    public synchronized boolean hasFile(long userId) {
        Session s = sessions.get(userId);
        return s != null && s.hasFile();
    }

    public synchronized boolean isActive(long userId) {
        return sessions.containsKey(userId);
    }

    /** 删除文件并移除会话；会话不存在时什么也不做 */
    public synchronized void cleanup(long userId) {
        Session s = sessions.remove(userId);
        if (s == null) return;
        if (s.getFilePath() != null) storage.delete(s.getFilePath());
        log.info("session cleaned up for user {}", userId);
    }

    /** 重新确认会话仍然过期后再清理；期间有活动则保留并返回 false */
    public synchronized boolean cleanupIfExpired(long userId) {
        Session s = sessions.get(userId);
        if (s == null) return false;
        if (idle(s, clock.instant()).compareTo(timeouts.expiryFor(s.hasFile())) < 0) {
            log.info("session of user {} became active again, kept", userId);
            return false;
        }
        cleanup(userId);
        return true;
    }

    public synchronized void markWarningSent(long userId) {
        Session s = sessions.get(userId);
        if (s != null) s.setWarningSent(true);
    }

    public synchronized boolean isWarningSent(long userId) {
        Session s = sessions.get(userId);
        return s != null && s.isWarningSent();
    }

    /** 闲置达到提醒阈值且尚未提醒的会话：标记为已提醒并返回 */
    public synchronized List<SessionNotice> sweepWarnings() {
        Instant now = clock.instant();
        List<SessionNotice> out = new ArrayList<>();
        for (Session s : sessions.values()) {
            if (s.isWarningSent()) continue;
            if (idle(s, now).compareTo(timeouts.warning()) >= 0) {
                s.setWarningSent(true);
                out.add(new SessionNotice(s.getUserId(), s.getChannel()));
            }
        }
        if (!out.isEmpty()) log.debug("sessions needing warning: {}", out.size());
        return out;
    }

    /** 闲置达到各自过期阈值的会话；只返回，不清理 */
    public synchronized List<SessionNotice> sweepExpirations() {
        Instant now = clock.instant();
        List<SessionNotice> out = new ArrayList<>();
        for (Session s : sessions.values()) {
            if (idle(s, now).compareTo(timeouts.expiryFor(s.hasFile())) >= 0) {
                out.add(new SessionNotice(s.getUserId(), s.getChannel()));
            }
        }
        if (!out.isEmpty()) log.debug("sessions to expire: {}", out.size());
        return out;
    }

    public synchronized long timeoutRemaining(long userId) {
        Session s = sessions.get(userId);
        if (s == null) return 0;
        Duration left = timeouts.expiryFor(s.hasFile()).minus(idle(s, clock.instant()));
        return Math.max(0, left.getSeconds());
    }

    public synchronized int activeCount() {
        return sessions.size();
    }

    private void touch(Session s) {
        s.setLastActivity(clock.instant());
        s.setWarningSent(false);
    }

    private void replaceFile(Session s, Path file) {
        Path old = s.getFilePath();
        s.setFilePath(file);
        if (old != null && !old.equals(file)) storage.delete(old);
    }

    private static Duration idle(Session s, Instant now) {
        return Duration.between(s.getLastActivity(), now);
    }
}
