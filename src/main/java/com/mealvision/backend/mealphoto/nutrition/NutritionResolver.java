package com.mealvision.backend.mealphoto.nutrition;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.Nutrient;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import com.mealvision.backend.mealphoto.nutrition.cache.NutritionCache;
import com.mealvision.backend.mealphoto.nutrition.search.NutritionSearchClient;
import com.mealvision.backend.mealphoto.nutrition.search.SearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 單一食物的營養查詢：快取 → 外部搜尋 → 文字抽取 → 備援表。
 * 不會因為查不到而丟例外；查不到就回 success=false、全 0。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NutritionResolver {

    static final int MIN_NUTRIENTS = 3;
    static final String BACKUP_NOTE = "Using estimated values from common food database";
    static final String NOT_FOUND = "No nutrition data found";

    private static final Set<String> GRAM_UNITS = Set.of("g", "gram", "grams");

    private final NutritionSearchClient searchClient;
    private final NutritionCache cache;

    public NutritionLookupResult resolve(String foodName, String quantity, String unit) {
        String key = NutritionCache.keyOf(foodName, quantity, unit);

        var cached = cache.get(key);
        if (cached.isPresent()) {
            log.info("nutrition_lookup source=cache food={}", foodName);
            return cached.get();
        }

        if (!searchClient.isConfigured()) {
            log.warn("nutrition_search_skipped reason=DISABLED_OR_UNCONFIGURED food={}", foodName);
            return fromBackup(foodName, quantity, unit);
        }

        String query = buildQuery(foodName, quantity, unit);
        List<SearchHit> hits;
        try {
            hits = searchClient.search(query);
        } catch (RuntimeException e) {
            log.warn("nutrition_search_failed food={} err={}", foodName, e.toString());
            return fromBackup(foodName, quantity, unit);
        }

        if (hits == null || hits.isEmpty()) {
            log.warn("nutrition_search_empty food={}", foodName);
            return fromBackup(foodName, quantity, unit);
        }

        Candidate best = pickBest(hits);
        if (best == null) {
            log.warn("nutrition_search_unparsed food={} hits={}", foodName, hits.size());
            return fromBackup(foodName, quantity, unit);
        }

        String serving = (hasText(quantity) && hasText(unit))
                ? quantity + unit
                : NutritionLookupResult.DEFAULT_SERVING;

        NutritionFacts facts = scaleIfGrams(NutritionFacts.fromMap(best.values()), quantity, unit);
        NutritionLookupResult result = new NutritionLookupResult(
                true, foodName, facts, serving, best.url(), best.confidence(), null);

        // 只快取搜尋成功的結果
        cache.putIfAbsent(key, result);
        log.info("nutrition_lookup source={} confidence={} food={}",
                best.url(), best.confidence().code(), foodName);
        return result;
    }

    /**
     * 第一個 high 就停；否則保留第一個可用的候選。
     * 可用 = 至少抓到 3 種營養素。
     */
    static Candidate pickBest(List<SearchHit> hits) {
        Candidate best = null;
        for (SearchHit h : hits) {
            ConfidenceTier tier = SourceConfidenceClassifier.classify(h.url());
            Map<Nutrient, Double> values = NutritionTextExtractor.extract(h.content());
            if (values.size() < MIN_NUTRIENTS) continue;

            if (best == null || tier == ConfidenceTier.HIGH) {
                best = new Candidate(h.url(), tier, values);
                if (tier == ConfidenceTier.HIGH) break;
            }
        }
        return best;
    }

    static String buildQuery(String foodName, String quantity, String unit) {
        String q = foodName + " nutrition facts calories protein carbs fat";
        if (hasText(quantity) && hasText(unit)) {
            q += " per " + quantity + " " + unit;
        }
        return q;
    }

    private NutritionLookupResult fromBackup(String foodName, String quantity, String unit) {
        var match = BackupNutritionTable.lookup(foodName);
        if (match.isEmpty()) {
            log.warn("nutrition_lookup source=none food={}", foodName);
            return NutritionLookupResult.notFound(foodName, NOT_FOUND);
        }

        NutritionFacts per100g = match.get().per100g();
        NutritionFacts facts = scaleIfGrams(per100g, quantity, unit);
        String serving = (facts == per100g) ? NutritionLookupResult.DEFAULT_SERVING : quantity + unit;

        log.info("nutrition_lookup source={} confidence=low food={} matched={}",
                NutritionLookupResult.SOURCE_ESTIMATED, foodName, match.get().key());
        return new NutritionLookupResult(true, foodName, facts, serving,
                NutritionLookupResult.SOURCE_ESTIMATED, ConfidenceTier.LOW, BACKUP_NOTE);
    }

    /** 來源一律以 100g 為基準；單位是克且數量可解析才縮放，否則原樣回傳 */
    private static NutritionFacts scaleIfGrams(NutritionFacts per100g, String quantity, String unit) {
        if (!hasText(quantity) || !isGrams(unit)) return per100g;
        try {
            double q = Double.parseDouble(quantity.trim());
            if (!Double.isFinite(q)) throw new NumberFormatException(quantity);
            return per100g.scaled(q / 100.0);
        } catch (NumberFormatException e) {
            log.warn("nutrition_scale_skipped quantity={}", quantity);
            return per100g;
        }
    }

    static boolean isGrams(String unit) {
        return unit != null && GRAM_UNITS.contains(unit.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    record Candidate(String url, ConfidenceTier confidence, Map<Nutrient, Double> values) {}
}
