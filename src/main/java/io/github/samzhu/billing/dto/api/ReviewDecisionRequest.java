package io.github.samzhu.billing.dto.api;

/**
 * 待審定價變更的處理說明。
 */
public record ReviewDecisionRequest(
    String reason
) {}
