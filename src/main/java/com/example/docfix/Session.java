package com.example.docfix;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个用户的编辑会话。由 {@link SessionManager} 持有和修改；
 * 对外只暴露快照副本。
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class Session {

    private final long userId;
    private SessionMode mode;
    private String channel;

    private Path filePath;
    private String originalName;

    private String findText;
    private String replaceText;
    private List<Occurrence> occurrences = new ArrayList<>();

    private List<Fix> pendingFixes = new ArrayList<>();
    private int reviewIndex;
    private List<Fix> reviewApplied = new ArrayList<>();
    private List<Fix> reviewSkipped = new ArrayList<>();

    private Instant lastActivity;
    private boolean warningSent;

    Session(long userId, SessionMode mode, String channel, Instant now) {
        this.userId = userId;
        this.mode = mode;
        this.channel = channel;
        this.lastActivity = now;
    }

    public boolean hasFile() { return filePath != null; }

    /** 丢弃所有待处理的查找/修正状态，文件引用不变 */
    void clearPending() {
        findText = null;
        replaceText = null;
        occurrences = new ArrayList<>();
        pendingFixes = new ArrayList<>();
        reviewIndex = 0;
        reviewApplied = new ArrayList<>();
        reviewSkipped = new ArrayList<>();
    }

    Session copy() {
        Session s = new Session(userId, mode, channel, lastActivity);
        s.filePath = filePath;
        s.originalName = originalName;
        s.findText = findText;
        s.replaceText = replaceText;
        s.occurrences = new ArrayList<>(occurrences);
        s.pendingFixes = new ArrayList<>(pendingFixes);
        s.reviewIndex = reviewIndex;
        s.reviewApplied = new ArrayList<>(reviewApplied);
        s.reviewSkipped = new ArrayList<>(reviewSkipped);
        s.warningSent = warningSent;
        return s;
    }
}
