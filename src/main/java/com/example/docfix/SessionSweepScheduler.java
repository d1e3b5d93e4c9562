package com.example.docfix;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定期扫描会话：先处理过期（先清理、再通知），再发送即将过期的提醒。
 * 扫描与清理之间有活动的会话不会被清理，也不发过期通知。
 * 单个用户的通知失败只记录，不影响其余用户，也不影响清理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionSweepScheduler {

    private final SessionManager sessionManager;
    private final UsageLimiter usageLimiter;
    private final SessionNotifier notifier;

    @Scheduled(fixedDelayString = "${docfix.session.sweep-interval-ms:30000}",
               initialDelayString = "${docfix.session.sweep-interval-ms:30000}")
    public void sweepSessions() {
        int expired = 0;
        for (SessionNotice n : sessionManager.sweepExpirations()) {
            if (!sessionManager.cleanupIfExpired(n.userId())) continue;
            expired++;
            try {
                notifier.sessionExpired(n);
            } catch (RuntimeException e) {
                log.error("failed to send expiry notice to user {}: {}", n.userId(), e.getMessage(), e);
            }
        }

        List<SessionNotice> warnings = sessionManager.sweepWarnings();
        for (SessionNotice n : warnings) {
            try {
                notifier.sessionWarning(n, sessionManager.timeoutRemaining(n.userId()));
            } catch (RuntimeException e) {
                log.error("failed to send warning to user {}: {}", n.userId(), e.getMessage(), e);
            }
        }

        if (expired > 0 || !warnings.isEmpty()) {
            log.info("session sweep: {} expired, {} warned, {} active",
                    expired, warnings.size(), sessionManager.activeCount());
        }
    }

    @Scheduled(fixedRateString = "${docfix.usage.sweep-interval-ms:3600000}")
    public void sweepUsage() {
        int removed = usageLimiter.sweepStaleUsers();
        log.debug("usage sweep removed {} stale user(s)", removed);
    }
}
