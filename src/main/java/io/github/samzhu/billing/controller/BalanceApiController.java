package io.github.samzhu.billing.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.dto.BalanceAudit;
import io.github.samzhu.billing.dto.PreflightResult;
import io.github.samzhu.billing.dto.TransactionStats;
import io.github.samzhu.billing.dto.api.AdjustmentRequest;
import io.github.samzhu.billing.dto.api.BalanceResponse;
import io.github.samzhu.billing.dto.api.DepositRequest;
import io.github.samzhu.billing.dto.api.RefundRequest;
import io.github.samzhu.billing.service.BalanceLedgerService;
import io.github.samzhu.billing.service.UsageMeterService;

/**
 * 餘額與帳本 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/balance/users/{userId}} - 目前餘額</li>
 *   <li>{@code GET /api/v1/balance/users/{userId}/preflight} - 對話前餘額預檢</li>
 *   <li>{@code POST /api/v1/balance/users/{userId}/deposits} - 入帳（付款流程呼叫）</li>
 *   <li>{@code POST /api/v1/balance/users/{userId}/adjustments} - 帳務調整</li>
 *   <li>{@code POST /api/v1/balance/transactions/{transactionId}/refunds} - 退款</li>
 *   <li>{@code GET /api/v1/balance/users/{userId}/transactions} - 交易歷史（分頁）</li>
 *   <li>{@code GET /api/v1/balance/users/{userId}/stats} - 各類交易總額</li>
 *   <li>{@code GET /api/v1/balance/users/{userId}/audit} - 重播歷史驗證餘額</li>
 * </ul>
 *
 * <p>錯誤回應由 {@link BillingExceptionHandler} 轉為 Problem Details。
 */
@RestController
@RequestMapping("/api/v1/balance")
public class BalanceApiController {

    private static final Logger log = LoggerFactory.getLogger(BalanceApiController.class);

    private final BalanceLedgerService ledger;
    private final UsageMeterService usageMeter;

    public BalanceApiController(BalanceLedgerService ledger, UsageMeterService usageMeter) {
        this.ledger = ledger;
        this.usageMeter = usageMeter;
    }

    // ========== 餘額查詢 ==========

    @GetMapping("/users/{userId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String userId) {
        log.debug("API request: getBalance userId={}", userId);
        return ResponseEntity.ok(BalanceResponse.fromUserBalance(ledger.getBalance(userId)));
    }

    @GetMapping("/users/{userId}/preflight")
    public ResponseEntity<PreflightResult> preflight(@PathVariable String userId) {
        return ResponseEntity.ok(usageMeter.checkPreflight(userId));
    }

    // ========== 帳本異動 ==========

    /**
     * 入帳。
     *
     * <p>相同 {@code externalRef} 重送時回傳原交易。
     */
    @PostMapping("/users/{userId}/deposits")
    public ResponseEntity<LedgerTransaction> deposit(
            @PathVariable String userId,
            @RequestBody @Validated DepositRequest request) {

        log.info("API request: deposit userId={}, amount={}, externalRef={}",
            userId, request.amount(), request.externalRef());

        return ResponseEntity.ok(ledger.deposit(userId, request.amount(), request.currency(),
            request.externalRef(), request.metadata()));
    }

    /**
     * 帳務調整。
     *
     * @param adjustedBy 管理員（從 header 取得）
     */
    @PostMapping("/users/{userId}/adjustments")
    public ResponseEntity<LedgerTransaction> adjust(
            @PathVariable String userId,
            @RequestBody @Validated AdjustmentRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String adjustedBy) {

        log.info("API request: adjust userId={}, amount={}, credit={}, adjustedBy={}",
            userId, request.amount(), request.credit(), adjustedBy);

        return ResponseEntity.ok(ledger.adjust(userId, request.amount(), request.credit(),
            request.reason(), request.requestId(), adjustedBy));
    }

    /**
     * 對扣款交易退款，未提供金額時退還剩餘全部。
     */
    @PostMapping("/transactions/{transactionId}/refunds")
    public ResponseEntity<LedgerTransaction> refund(
            @PathVariable String transactionId,
            @RequestBody(required = false) @Validated RefundRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String refundedBy) {

        RefundRequest body = request != null ? request : new RefundRequest(null, null);
        log.info("API request: refund transactionId={}, amount={}, refundedBy={}",
            transactionId, body.amount(), refundedBy);

        return ResponseEntity.ok(ledger.refund(transactionId, body.amount(), body.reason()));
    }

    // ========== 歷史與稽核 ==========

    @GetMapping("/users/{userId}/transactions")
    public ResponseEntity<Page<LedgerTransaction>> listTransactions(
            @PathVariable String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(ledger.listTransactions(userId, PageRequest.of(page, size)));
    }

    @GetMapping("/users/{userId}/stats")
    public ResponseEntity<TransactionStats> getStats(@PathVariable String userId) {
        return ResponseEntity.ok(ledger.getTransactionStats(userId));
    }

    @GetMapping("/users/{userId}/audit")
    public ResponseEntity<BalanceAudit> audit(@PathVariable String userId) {
        log.info("API request: audit userId={}", userId);
        return ResponseEntity.ok(ledger.audit(userId));
    }
}
