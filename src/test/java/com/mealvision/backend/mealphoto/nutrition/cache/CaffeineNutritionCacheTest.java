package com.mealvision.backend.mealphoto.nutrition.cache;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import com.mealvision.backend.mealphoto.nutrition.config.NutritionConfig;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineNutritionCacheTest {

    private static CaffeineNutritionCache newCache() {
        return new CaffeineNutritionCache(new NutritionConfig().nutritionCacheManager(100));
    }

    private static NutritionLookupResult result(String source, double kcal) {
        return new NutritionLookupResult(true, "rice",
                new NutritionFacts(kcal, 0, 0, 0, 0, 0, 0), "100g", source, ConfidenceTier.HIGH, null);
    }

    @Test
    void first_insert_wins() {
        CaffeineNutritionCache cache = newCache();

        cache.putIfAbsent("rice_null_null", result("https://fdc.nal.usda.gov/a", 130));
        cache.putIfAbsent("rice_null_null", result("https://fdc.nal.usda.gov/b", 999));

        assertThat(cache.get("rice_null_null")).hasValueSatisfying(r -> {
            assertThat(r.source()).endsWith("/a");
            assertThat(r.nutrition().calories()).isEqualTo(130.0);
        });
    }

    @Test
    void miss_and_null_key_are_empty() {
        CaffeineNutritionCache cache = newCache();

        assertThat(cache.get("nope")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void clear_drops_everything() {
        CaffeineNutritionCache cache = newCache();
        cache.putIfAbsent("a", result("s", 1));
        cache.putIfAbsent("b", result("s", 2));

        cache.clear();

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.estimatedSize()).isZero();
    }

    @Test
    void manager_without_the_named_caffeine_cache_is_rejected() {
        assertThatThrownBy(() -> new CaffeineNutritionCache(new ConcurrentMapCacheManager("other")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(CaffeineNutritionCache.CACHE_NAME);
    }
}
