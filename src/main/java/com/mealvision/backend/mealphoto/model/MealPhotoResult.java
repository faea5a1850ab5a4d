package com.mealvision.backend.mealphoto.model;

import java.util.List;

/**
 * 呼叫端拿到的結構化結果，不論成功或失敗都一定有值。
 * mealId 為 null 且 success=false：沒有寫入任何紀錄（或補救寫入也失敗）。
 */
public record MealPhotoResult(
        boolean success,
        Long mealId,
        String error,
        PipelineFailureKind failureKind,
        PartialResults partialResults,
        ConfidenceTier confidence,
        List<RecognizedItem> recognizedItems,
        List<NutritionEntry> nutritionData
) {

    public MealPhotoResult {
        recognizedItems = recognizedItems == null ? List.of() : List.copyOf(recognizedItems);
        nutritionData = nutritionData == null ? List.of() : List.copyOf(nutritionData);
        if (confidence == null) confidence = ConfidenceTier.LOW;
    }

    public static MealPhotoResult workflowFailed(String error) {
        return new MealPhotoResult(false, null, error, null, null, ConfidenceTier.LOW, List.of(), List.of());
    }
}
