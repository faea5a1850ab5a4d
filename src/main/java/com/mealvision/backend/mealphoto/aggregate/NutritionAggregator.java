package com.mealvision.backend.mealphoto.aggregate;

import com.mealvision.backend.mealphoto.model.Nutrient;
import com.mealvision.backend.mealphoto.model.NutritionEntry;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 各項目營養加總成整餐總量。
 * 用 BigDecimal 累加，結果與項目順序無關；每個欄位四捨五入到 2 位小數。
 */
@Slf4j
@Component
public class NutritionAggregator {

    public NutritionFacts sum(List<NutritionEntry> entries) {
        if (entries == null) {
            // 上游結構缺失才算錯；單一項目失敗早就是 0 的佔位
            throw new IllegalStateException("NUTRITION_ENTRIES_MISSING");
        }

        Map<Nutrient, BigDecimal> acc = new EnumMap<>(Nutrient.class);
        for (Nutrient n : Nutrient.values()) acc.put(n, BigDecimal.ZERO);

        for (NutritionEntry e : entries) {
            if (e == null || e.nutrition() == null) continue;
            for (Nutrient n : Nutrient.values()) {
                acc.merge(n, toDecimal(e.nutrition().get(n)), BigDecimal::add);
            }
        }

        Map<Nutrient, Double> totals = new EnumMap<>(Nutrient.class);
        acc.forEach((n, v) -> totals.put(n, v.setScale(2, RoundingMode.HALF_UP).doubleValue()));

        NutritionFacts out = NutritionFacts.fromMap(totals);
        log.debug("nutrition_totals items={} calories={}", entries.size(), out.calories());
        return out;
    }

    private static BigDecimal toDecimal(double v) {
        return Double.isFinite(v) ? BigDecimal.valueOf(v) : BigDecimal.ZERO;
    }
}
