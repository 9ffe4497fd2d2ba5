package io.github.samzhu.billing.service.alert;

/**
 * 告警通道。
 *
 * <p>實作可以拋出執行期例外，{@link AlertService} 會隔離單一通道的失敗。
 */
public interface AlertChannel {

    String name();

    /**
     * 是否會送到系統外部（例如 Slack）。只有日誌的部署會降低健康分數。
     */
    boolean external();

    void send(String title, String message);
}
