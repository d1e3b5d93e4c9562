package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class DocFixConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionTimeouts sessionTimeouts(@Value("${docfix.session.warning-seconds:300}") long warning,
                                           @Value("${docfix.session.idle-seconds:420}") long idle,
                                           @Value("${docfix.session.extended-seconds:600}") long extended) {
        SessionTimeouts t = new SessionTimeouts(
                Duration.ofSeconds(warning), Duration.ofSeconds(idle), Duration.ofSeconds(extended));
        log.info("session timeouts: warning {}s, idle {}s, with file {}s", warning, idle, extended);
        return t;
    }

    @Bean
    public UsageLimits usageLimits(@Value("${docfix.usage.limit:20}") int limit,
                                   @Value("${docfix.usage.warning-threshold:15}") int warningThreshold,
                                   @Value("${docfix.usage.window-days:7}") int windowDays) {
        return new UsageLimits(limit, warningThreshold, Duration.ofDays(windowDays));
    }

    @Bean
    public UserLocks userLocks() {
        return new UserLocks(64);
    }

    @Bean(name = "editExecutor", destroyMethod = "shutdown")
    public ExecutorService editExecutor(@Value("${docfix.edit.threads:4}") int threads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "docfix-edit-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }
}
