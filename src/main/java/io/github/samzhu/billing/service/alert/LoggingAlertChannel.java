package io.github.samzhu.billing.service.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 輸出到應用程式日誌的告警通道，永遠啟用。
 */
@Component
public class LoggingAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertChannel.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean external() {
        return false;
    }

    @Override
    public void send(String title, String message) {
        log.info("ALERT {}\n{}", title, message);
    }
}
