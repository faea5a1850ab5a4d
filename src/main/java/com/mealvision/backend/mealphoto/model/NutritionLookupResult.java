package com.mealvision.backend.mealphoto.model;

/**
 * 單一食物的營養查詢結果。
 * source：搜尋結果 URL、"estimated"（備援表）或 "none"（查不到）。
 */
public record NutritionLookupResult(
        boolean success,
        String foodName,
        NutritionFacts nutrition,
        String servingSize,
        String source,
        ConfidenceTier confidence,
        String error
) {

    public static final String SOURCE_ESTIMATED = "estimated";
    public static final String SOURCE_NONE = "none";
    public static final String DEFAULT_SERVING = "100g";

    public NutritionLookupResult {
        if (nutrition == null) nutrition = NutritionFacts.ZERO;
        if (confidence == null) confidence = ConfidenceTier.LOW;
        if (source == null || source.isBlank()) source = SOURCE_NONE;
    }

    public static NutritionLookupResult notFound(String foodName, String error) {
        return new NutritionLookupResult(false, foodName, NutritionFacts.ZERO,
                DEFAULT_SERVING, SOURCE_NONE, ConfidenceTier.LOW, error);
    }
}
