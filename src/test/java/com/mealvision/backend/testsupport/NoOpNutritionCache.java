package com.mealvision.backend.testsupport;

import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import com.mealvision.backend.mealphoto.nutrition.cache.NutritionCache;

import java.util.Optional;

/** 測試用：什麼都不存 */
public class NoOpNutritionCache implements NutritionCache {

    @Override
    public Optional<NutritionLookupResult> get(String key) {
        return Optional.empty();
    }

    @Override
    public void putIfAbsent(String key, NutritionLookupResult value) {
    }

    @Override
    public void clear() {
    }
}
