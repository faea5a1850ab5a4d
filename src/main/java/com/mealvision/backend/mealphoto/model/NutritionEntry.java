package com.mealvision.backend.mealphoto.model;

/** 一個辨識項目配上它的營養數字（查不到時是全 0 的佔位） */
public record NutritionEntry(
        RecognizedItem item,
        NutritionFacts nutrition,
        String source,
        ConfidenceTier confidence
) {

    public static NutritionEntry placeholder(RecognizedItem item) {
        return new NutritionEntry(item, NutritionFacts.ZERO, NutritionLookupResult.SOURCE_NONE, ConfidenceTier.LOW);
    }
}
