package com.mealvision.backend.mealphoto.nutrition.cache;

import com.mealvision.backend.mealphoto.model.NutritionLookupResult;

import java.util.Locale;
import java.util.Optional;

/**
 * 跨 pipeline 共用的查詢快取。只新增、不覆寫：同一個 key 第一次寫入的值就是最終值。
 */
public interface NutritionCache {

    Optional<NutritionLookupResult> get(String key);

    /** key 已存在時保留舊值 */
    void putIfAbsent(String key, NutritionLookupResult value);

    void clear();

    static String keyOf(String foodName, String quantity, String unit) {
        String name = foodName == null ? "null" : foodName.toLowerCase(Locale.ROOT);
        return name + "_" + quantity + "_" + unit;
    }
}
