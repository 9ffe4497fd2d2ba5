package io.github.samzhu.billing.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 變更偵測結果。
 *
 * @param totalModels 兩側出現過的模型總數
 * @param newModels 新模型數
 * @param updatedModels 價格變動的模型數
 * @param removedModels 供應商不再回報的模型數
 * @param unchangedModels 價格不變的模型數
 * @param autoApplicable 可自動套用的變更
 * @param requiresReview 需要人工審核的變更
 * @param unchanged 價格不變的模型
 * @param summary 人類可讀的摘要
 */
public record ChangeSet(
    int totalModels,
    int newModels,
    int updatedModels,
    int removedModels,
    int unchangedModels,
    List<DetectedChange> autoApplicable,
    List<DetectedChange> requiresReview,
    List<DetectedChange> unchanged,
    String summary
) {
    public ChangeSet {
        autoApplicable = List.copyOf(autoApplicable);
        requiresReview = List.copyOf(requiresReview);
        unchanged = List.copyOf(unchanged);
    }

    public static ChangeSet empty() {
        return new ChangeSet(0, 0, 0, 0, 0, List.of(), List.of(), List.of(), "No pricing changes detected");
    }

    /**
     * 有實際變更（不含 unchanged）的項目數。
     */
    public int totalChanges() {
        return newModels + updatedModels + removedModels;
    }

    public List<DetectedChange> allChanges() {
        List<DetectedChange> all = new ArrayList<>(autoApplicable);
        all.addAll(requiresReview);
        return all;
    }
}
