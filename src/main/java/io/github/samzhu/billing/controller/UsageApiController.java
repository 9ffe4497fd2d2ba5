package io.github.samzhu.billing.controller;

import java.time.LocalDate;
import java.time.ZoneOffset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.UsageSummary;
import io.github.samzhu.billing.dto.api.UsageReportRequest;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.service.UsageMeterService;
import io.github.samzhu.billing.service.UsageQueryService;

/**
 * 用量 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/usage/reports} - 回報用量並扣款（與 CloudEvent 消費者相同流程）</li>
 *   <li>{@code GET /api/v1/usage/users/{userId}/summary} - 用戶期間用量摘要</li>
 *   <li>{@code GET /api/v1/usage/reconciliation} - 待人工對帳的用量紀錄</li>
 * </ul>
 *
 * <p>日期參數使用 ISO 格式：{@code YYYY-MM-DD}，以 UTC 日界計算
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    private final UsageMeterService usageMeter;
    private final UsageQueryService queryService;

    public UsageApiController(UsageMeterService usageMeter, UsageQueryService queryService) {
        this.usageMeter = usageMeter;
        this.queryService = queryService;
    }

    @PostMapping("/reports")
    public ResponseEntity<ChargeResult> report(@RequestBody @Validated UsageReportRequest request) {
        log.info("API request: usage report userId={}, model={}, totalTokens={}, requestId={}",
            request.userId(), request.model(), request.totalTokens(), request.requestId());
        return ResponseEntity.ok(usageMeter.recordAndCharge(request.toData().toCharge(request.requestId())));
    }

    /**
     * 查詢用戶用量摘要。
     *
     * @param userId 用戶 ID
     * @param startDate 起始日期（含）
     * @param endDate 結束日期（含）
     */
    @GetMapping("/users/{userId}/summary")
    public ResponseEntity<UsageSummary> getUserSummary(
            @PathVariable String userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        if (endDate.isBefore(startDate)) {
            throw new InvalidUsageException("endDate must not be before startDate");
        }
        log.info("API request: getUserSummary userId={}, period={} to {}", userId, startDate, endDate);

        return ResponseEntity.ok(queryService.getUserSummary(userId,
            startDate.atStartOfDay().toInstant(ZoneOffset.UTC),
            endDate.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC)));
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<Page<UsageRecord>> getReconciliationPending(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(queryService.getReconciliationPending(PageRequest.of(page, size)));
    }
}
