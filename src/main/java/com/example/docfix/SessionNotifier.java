package com.example.docfix;

/**
 * 会话超时通知的出口。channel 可能为空（会话创建时未提供回传渠道），
 * 实现应当自行决定此时是否跳过。
 */
public interface SessionNotifier {

    void sessionWarning(SessionNotice notice, long secondsLeft);

    void sessionExpired(SessionNotice notice);
}
