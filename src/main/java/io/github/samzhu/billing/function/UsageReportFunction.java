package io.github.samzhu.billing.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.UsageReportData;
import io.github.samzhu.billing.exception.IdempotencyConflictException;
import io.github.samzhu.billing.exception.InsufficientBalanceException;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.exception.LedgerValidationException;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.service.UsageMeterService;

/**
 * CloudEvents 用量回報消費者配置。
 *
 * <p>對話管線以 <b>Structured Mode</b> ({@code application/cloudevents+json}) 發送每一輪的 token 用量，
 * Spring Cloud Stream 自動解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（自動轉換為 {@link UsageReportData}）</li>
 * </ul>
 *
 * <p>冪等鍵：payload 的 {@code requestId}，沒有時使用 CloudEvent {@code id}。
 * 重複投遞的事件不會重複扣款。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>資料錯誤、找不到定價、餘額不足、冪等鍵衝突、帳本驗證失敗：記錄後確認訊息，重送也不會成功</li>
 *   <li>帳本寫入失敗：重新拋出，交由 binder 重新投遞</li>
 * </ul>
 *
 * <p>Binding name: {@code usageReportConsumer-in-0}
 *
 * @see <a href="https://spring.io/blog/2020/12/23/cloud-events-and-spring-part-2/">Cloud Events and Spring - part 2</a>
 */
@Configuration
public class UsageReportFunction {

    private static final Logger log = LoggerFactory.getLogger(UsageReportFunction.class);

    private final UsageMeterService usageMeter;

    public UsageReportFunction(UsageMeterService usageMeter) {
        this.usageMeter = usageMeter;
    }

    /**
     * CloudEvents 用量回報消費者 Bean。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<UsageReportData>> usageReportConsumer() {
        return message -> {
            UsageReportData data = message.getPayload();
            String eventId = CloudEventMessageUtils.getId(message);

            log.debug("CloudEvent received: id={}, type={}, source={}, userId={}",
                eventId,
                CloudEventMessageUtils.getType(message),
                CloudEventMessageUtils.getSource(message),
                data.userId());

            try {
                ChargeResult result = usageMeter.recordAndCharge(data.toCharge(eventId));
                log.debug("Usage report consumed: userId={}, model={}, cost={}, status={}, replayed={}",
                    data.userId(), data.model(), result.cost(), result.status(), result.replayed());
            } catch (InvalidUsageException e) {
                log.error("Usage report rejected: id={}, error={}", eventId, e.getMessage());
            } catch (NoPricingException e) {
                log.error("Usage report not billable, no pricing: id={}, provider={}, model={}",
                    eventId, e.getProviderId(), e.getModelId());
            } catch (InsufficientBalanceException e) {
                log.warn("Usage report not charged, insufficient balance: id={}, userId={}, shortfall={}",
                    eventId, e.getUserId(), e.getShortfall());
            } catch (IdempotencyConflictException e) {
                log.error("Usage report rejected, idempotency conflict: id={}, userId={}, key={}, error={}",
                    eventId, data.userId(), e.getIdempotencyKey(), e.getMessage());
            } catch (LedgerValidationException e) {
                log.error("Usage report rejected by ledger: id={}, userId={}, error={}",
                    eventId, data.userId(), e.getMessage());
            }
        };
    }
}
