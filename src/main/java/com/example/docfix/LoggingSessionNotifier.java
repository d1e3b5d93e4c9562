package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 默认通知实现：只写日志。接入真实消息渠道时替换此 bean。 */
@Slf4j
@Component
public class LoggingSessionNotifier implements SessionNotifier {

    @Override
    public void sessionWarning(SessionNotice notice, long secondsLeft) {
        log.info("[NOTIFY] user {} (channel {}): session will expire in {}s",
                notice.userId(), notice.hasChannel() ? notice.channel() : "-", secondsLeft);
    }

    @Override
    public void sessionExpired(SessionNotice notice) {
        log.info("[NOTIFY] user {} (channel {}): session expired, data cleared",
                notice.userId(), notice.hasChannel() ? notice.channel() : "-");
    }
}
