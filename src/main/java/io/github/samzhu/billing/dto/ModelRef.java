package io.github.samzhu.billing.dto;

import io.github.samzhu.billing.exception.InvalidUsageException;

/**
 * {@code providerId:modelId} 格式的模型參照。
 *
 * <p>只在第一個冒號切分，模型 ID 本身可以包含冒號。
 */
public record ModelRef(String providerId, String modelId) {

    public static ModelRef parse(String value) {
        if (value == null) {
            throw new InvalidUsageException("Model reference is required");
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new InvalidUsageException(
                "Invalid model reference '" + value + "', expected format providerId:modelId");
        }
        return new ModelRef(value.substring(0, separator), value.substring(separator + 1));
    }

    @Override
    public String toString() {
        return providerId + ":" + modelId;
    }
}
