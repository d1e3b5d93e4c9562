package com.example.docfix;

import java.time.Duration;

/**
 * 两级超时：未上传文件的会话按 idle 过期，已上传文件的按 extended 过期；
 * warning 早于两者，用于过期前的提醒。
 */
public record SessionTimeouts(Duration warning, Duration idle, Duration extended) {

    public SessionTimeouts {
        if (warning.isNegative() || warning.isZero()) {
            throw new IllegalArgumentException("warning timeout must be positive");
        }
        if (warning.compareTo(idle) >= 0 || warning.compareTo(extended) >= 0) {
            throw new IllegalArgumentException("warning timeout must be shorter than both expiry timeouts");
        }
        if (idle.compareTo(extended) > 0) {
            throw new IllegalArgumentException("idle timeout must not exceed the extended timeout");
        }
    }

    public Duration expiryFor(boolean hasFile) { return hasFile ? extended : idle; }
}
