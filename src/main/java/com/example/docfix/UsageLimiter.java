package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * 按用户统计分析请求次数（滚动窗口）。每次检查或记录前先丢弃窗口外的时间戳，
 * 没有固定的重置时刻；全部过期的用户由定期清理移除。
 */
@Slf4j
@Component
public class UsageLimiter {

    private final Map<Long, Deque<Instant>> usage = new HashMap<>();
    private final UsageLimits limits;
    private final Clock clock;

    public UsageLimiter(UsageLimits limits, Clock clock) {
        this.limits = limits;
        this.clock = clock;
    }

    public synchronized UsageCheck canUse(long userId) {
        int used = expire(userId, clock.instant());
        int remaining = limits.limit() - used;

        if (remaining <= 0) {
            log.warn("[LIMIT] user {} blocked: limit reached ({}/{})", userId, used, limits.limit());
            return new UsageCheck(false, 0, UsageStatus.LIMIT_REACHED);
        }
        if (used >= limits.warningThreshold()) {
            log.info("[LIMIT] user {} approaching limit: {}/{} used, {} remaining",
                    userId, used, limits.limit(), remaining);
            return new UsageCheck(true, remaining, UsageStatus.LIMIT_WARNING);
        }
        return new UsageCheck(true, remaining, UsageStatus.OK);
    }

    /**
     * 检查并计数，二者在同一把锁内完成；不允许时不计数。
     * 返回的 remaining 与 status 是计入本次之后的值。
     */
    public synchronized UsageCheck tryAcquire(long userId) {
        Instant now = clock.instant();
        int used = expire(userId, now);
        if (used >= limits.limit()) {
            log.warn("[LIMIT] user {} blocked: limit reached ({}/{})", userId, used, limits.limit());
            return new UsageCheck(false, 0, UsageStatus.LIMIT_REACHED);
        }
        usage.computeIfAbsent(userId, k -> new ArrayDeque<>()).addLast(now);
        used++;
        int remaining = limits.limit() - used;
        log.info("[LIMIT] user {} acquired analysis. usage: {}/{}, remaining: {}", userId, used, limits.limit(), remaining);
        return new UsageCheck(true, remaining, statusFor(used));
    }

    /** 撤销最近一次计数，用于已计数但请求失败的情况 */
    public synchronized void refund(long userId) {
        Deque<Instant> q = usage.get(userId);
        if (q == null || q.isEmpty()) return;
        q.pollLast();
        log.info("[LIMIT] user {} refunded one use, usage: {}/{}", userId, q.size(), limits.limit());
    }

    /** 在一次成功的分析请求之后调用；返回记录后的剩余次数 */
    public synchronized int recordUse(long userId) {
        Instant now = clock.instant();
        usage.computeIfAbsent(userId, k -> new ArrayDeque<>()).addLast(now);
        int used = expire(userId, now);
        int remaining = limits.limit() - used;
        log.info("[LIMIT] user {} used analysis. usage: {}/{}, remaining: {}", userId, used, limits.limit(), remaining);
        return remaining;
    }

    public synchronized UsageStats usage(long userId) {
        return new UsageStats(expire(userId, clock.instant()), limits.limit());
    }

    /** 最早一条记录的过期时刻，即用户再次获得额度的时间；无记录时为空 */
    public synchronized Optional<Instant> nextExpiry(long userId) {
        expire(userId, clock.instant());
        Deque<Instant> q = usage.get(userId);
        if (q == null || q.isEmpty()) return Optional.empty();
        return Optional.of(q.peekFirst().plus(limits.window()));
    }

    /** 移除所有记录均已过期的用户，返回移除数量 */
    public synchronized int sweepStaleUsers() {
        Instant cutoff = clock.instant().minus(limits.window());
        int removed = 0;
        Iterator<Map.Entry<Long, Deque<Instant>>> it = usage.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Instant> q = it.next().getValue();
            boolean stale = q.stream().noneMatch(ts -> ts.isAfter(cutoff));
            if (stale) { it.remove(); removed++; }
        }
        if (removed > 0) log.debug("[LIMIT] cleanup: removed {} stale user entries", removed);
        return removed;
    }

    synchronized int trackedUsers() {
        return usage.size();
    }

    private UsageStatus statusFor(int used) {
        if (used >= limits.limit()) return UsageStatus.LIMIT_REACHED;
        if (used >= limits.warningThreshold()) return UsageStatus.LIMIT_WARNING;
        return UsageStatus.OK;
    }

    // 时间戳按记录顺序入队，队首最旧
    private int expire(long userId, Instant now) {
        Deque<Instant> q = usage.get(userId);
        if (q == null) return 0;
        Instant cutoff = now.minus(limits.window());
        while (!q.isEmpty() && !q.peekFirst().isAfter(cutoff)) q.pollFirst();
        return q.size();
    }
}
