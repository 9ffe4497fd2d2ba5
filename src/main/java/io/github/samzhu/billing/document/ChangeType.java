package io.github.samzhu.billing.document;

/**
 * 定價變更類型。
 */
public enum ChangeType {
    NEW,
    UPDATED,
    REMOVED,
    UNCHANGED
}
