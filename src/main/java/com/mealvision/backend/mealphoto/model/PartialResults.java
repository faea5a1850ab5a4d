package com.mealvision.backend.mealphoto.model;

import java.util.List;

/** 失敗時留給使用者手動補完的中間結果 */
public record PartialResults(
        List<RecognizedItem> recognizedItems,
        List<NutritionEntry> nutritionData,
        List<String> needsWebSearch,
        ConfidenceTier confidence
) {

    public PartialResults {
        recognizedItems = recognizedItems == null ? List.of() : List.copyOf(recognizedItems);
        nutritionData = nutritionData == null ? List.of() : List.copyOf(nutritionData);
        needsWebSearch = needsWebSearch == null ? List.of() : List.copyOf(needsWebSearch);
        if (confidence == null) confidence = ConfidenceTier.LOW;
    }
}
