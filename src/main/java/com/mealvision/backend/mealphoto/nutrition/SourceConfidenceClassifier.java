package com.mealvision.backend.mealphoto.nutrition;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;

import java.util.Locale;

/** 來源網域 → 可信度：USDA 高、常見紀錄 App 中、其他低 */
public final class SourceConfidenceClassifier {

    private SourceConfidenceClassifier() {}

    public static ConfidenceTier classify(String url) {
        if (url == null || url.isBlank()) return ConfidenceTier.LOW;
        String u = url.toLowerCase(Locale.ROOT);
        if (u.contains("usda.gov") || u.contains("fdc.nal.usda.gov")) return ConfidenceTier.HIGH;
        if (u.contains("nutritionix.com") || u.contains("myfitnesspal.com")) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }
}
