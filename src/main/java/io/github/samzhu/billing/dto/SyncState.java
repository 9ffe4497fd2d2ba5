package io.github.samzhu.billing.dto;

/**
 * 定價同步的狀態機。
 *
 * <pre>
 * IDLE → FETCHING → DETECTING → DRY_RUN_DONE → IDLE
 *                            └→ APPLYING → APPLIED → IDLE
 * 任何狀態 → FAILED
 * </pre>
 */
public enum SyncState {
    IDLE,
    FETCHING,
    DETECTING,
    DRY_RUN_DONE,
    APPLYING,
    APPLIED,
    FAILED;

    /**
     * 判斷是否允許轉移到下一個狀態。
     */
    public boolean canTransitionTo(SyncState next) {
        if (next == FAILED) {
            return this != IDLE && this != FAILED;
        }
        return switch (this) {
            case IDLE -> next == FETCHING;
            case FETCHING -> next == DETECTING;
            case DETECTING -> next == DRY_RUN_DONE || next == APPLYING;
            case APPLYING -> next == APPLIED;
            case DRY_RUN_DONE, APPLIED, FAILED -> next == IDLE;
        };
    }
}
