package com.mealvision.backend.mealphoto.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * 七個營養素永遠都有值（沒查到就是 0.0）。
 * 單位：calories kcal，sodium mg，其餘 g。
 */
public record NutritionFacts(
        double calories,
        double protein,
        double carbs,
        double fat,
        double fiber,
        double sugar,
        double sodium
) {

    public static final NutritionFacts ZERO = new NutritionFacts(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);

    public NutritionFacts {
        calories = finiteOrZero(calories);
        protein = finiteOrZero(protein);
        carbs = finiteOrZero(carbs);
        fat = finiteOrZero(fat);
        fiber = finiteOrZero(fiber);
        sugar = finiteOrZero(sugar);
        sodium = finiteOrZero(sodium);
    }

    /** 缺的營養素補 0.0 */
    public static NutritionFacts fromMap(Map<Nutrient, Double> values) {
        if (values == null || values.isEmpty()) return ZERO;
        return new NutritionFacts(
                get(values, Nutrient.CALORIES),
                get(values, Nutrient.PROTEIN),
                get(values, Nutrient.CARBS),
                get(values, Nutrient.FAT),
                get(values, Nutrient.FIBER),
                get(values, Nutrient.SUGAR),
                get(values, Nutrient.SODIUM)
        );
    }

    public double get(Nutrient n) {
        return switch (n) {
            case CALORIES -> calories;
            case PROTEIN -> protein;
            case CARBS -> carbs;
            case FAT -> fat;
            case FIBER -> fiber;
            case SUGAR -> sugar;
            case SODIUM -> sodium;
        };
    }

    /** 以 100g 為基準線性縮放，每個值四捨五入到 1 位小數 */
    public NutritionFacts scaled(double factor) {
        return new NutritionFacts(
                round(calories * factor, 1),
                round(protein * factor, 1),
                round(carbs * factor, 1),
                round(fat * factor, 1),
                round(fiber * factor, 1),
                round(sugar * factor, 1),
                round(sodium * factor, 1)
        );
    }

    public static double round(double v, int scale) {
        if (!Double.isFinite(v)) return 0.0;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static double get(Map<Nutrient, Double> values, Nutrient n) {
        Double v = values.get(n);
        return v == null ? 0.0 : v;
    }

    private static double finiteOrZero(double v) {
        return Double.isFinite(v) ? v : 0.0;
    }
}
