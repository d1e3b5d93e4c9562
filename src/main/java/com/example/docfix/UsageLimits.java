package com.example.docfix;

import java.time.Duration;

/** 滚动窗口内最多 limit 次；已用次数达到 warningThreshold 起提示接近上限 */
public record UsageLimits(int limit, int warningThreshold, Duration window) {

    public UsageLimits {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        if (warningThreshold < 0 || warningThreshold >= limit) {
            throw new IllegalArgumentException("warning threshold must be in [0, limit)");
        }
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be positive");
    }
}
