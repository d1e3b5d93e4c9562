package com.example.docfix;

import lombok.Getter;

import java.time.Instant;

@Getter
public class UsageLimitExceededException extends DocFixException {

    private final Instant retryAt;

    public UsageLimitExceededException(long userId, int limit, Instant retryAt) {
        super("Usage limit reached for user " + userId + " (" + limit + " per window)."
                + (retryAt != null ? " Available again at " + retryAt + "." : ""));
        this.retryAt = retryAt;
    }
}
