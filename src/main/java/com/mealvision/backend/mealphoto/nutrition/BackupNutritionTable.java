package com.mealvision.backend.mealphoto.nutrition;

import com.mealvision.backend.mealphoto.model.NutritionFacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 常見食物每 100g 的估計值，搜尋不可用或查不到時使用。
 * 依固定順序比對，名稱互相包含即命中（"grilled chicken breast" → chicken breast）。
 */
public final class BackupNutritionTable {

    public record Match(String key, NutritionFacts per100g) {}

    private static final Map<String, NutritionFacts> TABLE;

    static {
        Map<String, NutritionFacts> m = new LinkedHashMap<>();
        m.put("chicken breast", new NutritionFacts(165, 31.0, 0.0, 3.6, 0.0, 0.0, 74.0));
        m.put("rice", new NutritionFacts(130, 2.7, 28.0, 0.3, 0.4, 0.1, 1.0));
        m.put("broccoli", new NutritionFacts(34, 2.8, 7.0, 0.4, 2.6, 1.7, 33.0));
        m.put("salmon", new NutritionFacts(208, 20.0, 0.0, 13.0, 0.0, 0.0, 59.0));
        m.put("egg", new NutritionFacts(155, 13.0, 1.1, 11.0, 0.0, 1.1, 124.0));
        m.put("banana", new NutritionFacts(89, 1.1, 23.0, 0.3, 2.6, 12.0, 1.0));
        m.put("apple", new NutritionFacts(52, 0.3, 14.0, 0.2, 2.4, 10.0, 1.0));
        TABLE = Collections.unmodifiableMap(m);
    }

    private BackupNutritionTable() {}

    public static Optional<Match> lookup(String foodName) {
        if (foodName == null || foodName.isBlank()) return Optional.empty();
        String q = foodName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, NutritionFacts> e : TABLE.entrySet()) {
            String key = e.getKey();
            if (q.contains(key) || key.contains(q)) {
                return Optional.of(new Match(key, e.getValue()));
            }
        }
        return Optional.empty();
    }
}
