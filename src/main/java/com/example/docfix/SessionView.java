package com.example.docfix;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 会话对外视图；timeoutRemaining 为距过期的秒数 */
public record SessionView(
        @JsonProperty("user_id") long userId,
        SessionMode mode,
        @JsonProperty("has_file") boolean hasFile,
        @JsonProperty("original_name") String originalName,
        @JsonProperty("pending_fixes") int pendingFixes,
        @JsonProperty("review_index") int reviewIndex,
        @JsonProperty("timeout_remaining") long timeoutRemaining
) {

    static SessionView of(Session s, long timeoutRemaining) {
        return new SessionView(s.getUserId(), s.getMode(), s.hasFile(), s.getOriginalName(),
                s.getPendingFixes().size(), s.getReviewIndex(), timeoutRemaining);
    }
}
