package com.mealvision.backend.mealphoto.nutrition.cache;

import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;

import java.util.Optional;

/**
 * 包一層 CaffeineCacheManager 管的 cache：有上限、不過期；超過上限由 Caffeine 依使用頻率淘汰。
 * 只插不改，同一個 key 先寫入的贏。
 */
@Slf4j
public class CaffeineNutritionCache implements NutritionCache {

    public static final String CACHE_NAME = "nutritionLookup";

    private final CaffeineCache cache;

    public CaffeineNutritionCache(CacheManager cacheManager) {
        Cache c = cacheManager.getCache(CACHE_NAME);
        if (!(c instanceof CaffeineCache caffeine)) {
            throw new IllegalStateException("NUTRITION_CACHE_NOT_CAFFEINE: " + CACHE_NAME);
        }
        this.cache = caffeine;
    }

    @Override
    public Optional<NutritionLookupResult> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(cache.get(key, NutritionLookupResult.class));
    }

    @Override
    public void putIfAbsent(String key, NutritionLookupResult value) {
        if (key == null || value == null) return;
        cache.putIfAbsent(key, value);
    }

    @Override
    public void clear() {
        cache.clear();
        log.info("nutrition_cache_cleared");
    }

    long estimatedSize() {
        return cache.getNativeCache().estimatedSize();
    }
}
