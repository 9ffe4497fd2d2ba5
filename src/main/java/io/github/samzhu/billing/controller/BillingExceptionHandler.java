package io.github.samzhu.billing.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.billing.exception.IdempotencyConflictException;
import io.github.samzhu.billing.exception.InsufficientBalanceException;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.exception.LedgerPersistenceException;
import io.github.samzhu.billing.exception.LedgerValidationException;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.exception.PricingChangeNotFoundException;
import io.github.samzhu.billing.exception.SyncInProgressException;
import io.github.samzhu.billing.exception.TransactionNotFoundException;

/**
 * REST API 錯誤處理。
 *
 * <p>將領域例外轉為 RFC 7807 Problem Details：
 * <ul>
 *   <li>400 - {@link InvalidUsageException}、{@link LedgerValidationException}、請求欄位驗證失敗</li>
 *   <li>402 - {@link InsufficientBalanceException}</li>
 *   <li>404 - {@link TransactionNotFoundException}、{@link PricingChangeNotFoundException}</li>
 *   <li>409 - {@link IdempotencyConflictException}、{@link SyncInProgressException}</li>
 *   <li>422 - {@link NoPricingException}</li>
 *   <li>503 - {@link LedgerPersistenceException}</li>
 * </ul>
 */
@RestControllerAdvice(basePackages = "io.github.samzhu.billing.controller")
public class BillingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BillingExceptionHandler.class);

    @ExceptionHandler({InvalidUsageException.class, LedgerValidationException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(RuntimeException ex) {
        log.warn("Request rejected: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("Request validation failed: {}", errors);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problem.setTitle("Validation Failed");
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientBalance(InsufficientBalanceException ex) {
        log.warn("Insufficient balance: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.PAYMENT_REQUIRED, ex.getMessage());
        problem.setTitle("Insufficient Balance");
        problem.setProperty("balance", ex.getBalance());
        problem.setProperty("required", ex.getRequired());
        problem.setProperty("shortfall", ex.getShortfall());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(problem);
    }

    @ExceptionHandler({TransactionNotFoundException.class, PricingChangeNotFoundException.class})
    public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex) {
        log.debug("Resource not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ProblemDetail> handleIdempotencyConflict(IdempotencyConflictException ex) {
        log.warn("Idempotency conflict: {}", ex.getMessage());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.CONFLICT, "Idempotency Conflict", ex.getMessage());
        response.getBody().setProperty("idempotencyKey", ex.getIdempotencyKey());
        return response;
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ProblemDetail> handleSyncInProgress(SyncInProgressException ex) {
        log.info("Sync request rejected: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Sync In Progress", ex.getMessage());
    }

    @ExceptionHandler(NoPricingException.class)
    public ResponseEntity<ProblemDetail> handleNoPricing(NoPricingException ex) {
        log.warn("No pricing: {}", ex.getMessage());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.UNPROCESSABLE_ENTITY, "No Pricing", ex.getMessage());
        response.getBody().setProperty("providerId", ex.getProviderId());
        response.getBody().setProperty("modelId", ex.getModelId());
        return response;
    }

    @ExceptionHandler(LedgerPersistenceException.class)
    public ResponseEntity<ProblemDetail> handlePersistence(LedgerPersistenceException ex) {
        log.error("Ledger persistence failure: userId={}, attempts={}, error={}",
            ex.getUserId(), ex.getAttempts(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Ledger Unavailable",
            "Balance could not be updated, retry with the same request id");
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return ResponseEntity.status(status).body(problem);
    }
}
