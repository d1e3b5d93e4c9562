package com.example.docfix;

/** 超时扫描的输出：需要提醒或过期处理的用户及其通知渠道（可能为空） */
public record SessionNotice(long userId, String channel) {

    public boolean hasChannel() { return channel != null && !channel.isBlank(); }
}
