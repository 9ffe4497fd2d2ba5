package io.github.samzhu.billing.service.alert;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.dto.SyncResult;

/**
 * 告警服務。
 *
 * <p>將訊息送到所有已註冊的 {@link AlertChannel}，單一通道失敗只記錄 WARN，不影響其他通道，
 * 也不會影響呼叫端的同步或計費流程。
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final List<AlertChannel> channels;
    private final SyncReportFormatter formatter;

    public AlertService(List<AlertChannel> channels, SyncReportFormatter formatter) {
        this.channels = List.copyOf(channels);
        this.formatter = formatter;
        log.info("Alert channels configured: {}", this.channels.stream().map(AlertChannel::name).toList());
    }

    /**
     * 同步結果通知。只有非 dry run 且至少套用一筆變更時才會送出。
     *
     * @return 是否有送出
     */
    public boolean notify(SyncResult result) {
        if (result.dryRun() || result.changes().applied() == 0) {
            log.debug("Sync alert skipped: syncId={}, dryRun={}, applied={}",
                result.syncId(), result.dryRun(), result.changes().applied());
            return false;
        }
        dispatch(formatter.title(result), formatter.formatSyncMessage(result));
        return true;
    }

    /**
     * 需要人工介入的嚴重告警，例如扣款成功但用量紀錄寫入失敗。
     */
    public void critical(String title, String details) {
        dispatch("[CRITICAL] " + title, details);
    }

    /**
     * 是否設定了系統外部的告警通道。
     */
    public boolean hasExternalChannel() {
        return channels.stream().anyMatch(AlertChannel::external);
    }

    private void dispatch(String title, String message) {
        for (AlertChannel channel : channels) {
            try {
                channel.send(title, message);
            } catch (RuntimeException e) {
                log.warn("Alert channel failed: channel={}, title={}, error={}", channel.name(), title, e.getMessage());
            }
        }
    }
}
