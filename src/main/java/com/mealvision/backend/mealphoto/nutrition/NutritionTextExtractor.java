package com.mealvision.backend.mealphoto.nutrition;

import com.mealvision.backend.mealphoto.model.Nutrient;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 從搜尋結果內文抓營養數字。
 * 每個營養素一組 pattern，依序嘗試，第一個命中的就採用（順序不可調換）。
 * 只用 [ \t] 當空白，不跨行比對。
 */
public final class NutritionTextExtractor {

    private static final String NUM = "(\\d+\\.?\\d*)";
    private static final String GRAMS = "g(?:rams?)?";

    private static final Map<Nutrient, List<Pattern>> PATTERNS = new EnumMap<>(Nutrient.class);

    static {
        PATTERNS.put(Nutrient.CALORIES, compile(
                "\\b" + NUM + "[ \\t]*calories\\b",
                "\\bcalories:?[ \\t]+" + NUM,
                "\\benergy:?[ \\t]+" + NUM + "[ \\t]*kcal",
                "\\b" + NUM + "[ \\t]*kcal\\b"
        ));
        PATTERNS.put(Nutrient.PROTEIN, compile(
                "\\b" + NUM + "[ \\t]*" + GRAMS + "[ \\t]+protein\\b",
                "\\bprotein:?[ \\t]+" + NUM + "[ \\t]*" + GRAMS + "\\b"
        ));
        PATTERNS.put(Nutrient.CARBS, compile(
                "\\b" + NUM + "[ \\t]*" + GRAMS + "[ \\t]+carb",
                "\\bcarb(?:ohydrate)?s?:?[ \\t]+" + NUM + "[ \\t]*" + GRAMS + "\\b"
        ));
        PATTERNS.put(Nutrient.FAT, compile(
                "\\b" + NUM + "[ \\t]*" + GRAMS + "[ \\t]+(?:total[ \\t]+)?fat\\b",
                "\\b(?:total[ \\t]+)?fat:?[ \\t]+" + NUM + "[ \\t]*" + GRAMS + "\\b"
        ));
        PATTERNS.put(Nutrient.FIBER, compile(
                "\\b" + NUM + "[ \\t]*" + GRAMS + "[ \\t]+(?:dietary[ \\t]+)?fiber\\b",
                "\\b(?:dietary[ \\t]+)?fiber:?[ \\t]+" + NUM + "[ \\t]*" + GRAMS + "\\b"
        ));
        PATTERNS.put(Nutrient.SUGAR, compile(
                "\\b" + NUM + "[ \\t]*" + GRAMS + "[ \\t]+(?:total[ \\t]+)?sugars?\\b",
                "\\b(?:total[ \\t]+)?sugars?:?[ \\t]+" + NUM + "[ \\t]*" + GRAMS + "\\b"
        ));
        PATTERNS.put(Nutrient.SODIUM, compile(
                "\\b" + NUM + "[ \\t]*mg[ \\t]+sodium\\b",
                "\\bsodium:?[ \\t]+" + NUM + "[ \\t]*mg\\b"
        ));
    }

    private NutritionTextExtractor() {}

    /** 只回傳有抓到的營養素；沒抓到的 key 不存在 */
    public static Map<Nutrient, Double> extract(String text) {
        Map<Nutrient, Double> out = new EnumMap<>(Nutrient.class);
        if (text == null || text.isBlank()) return out;

        String s = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Nutrient, List<Pattern>> e : PATTERNS.entrySet()) {
            for (Pattern p : e.getValue()) {
                Matcher m = p.matcher(s);
                if (!m.find()) continue;
                Double v = parseOrNull(m.group(1));
                if (v != null) {
                    out.put(e.getKey(), v);
                    break;
                }
            }
        }
        return out;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }

    private static Double parseOrNull(String raw) {
        try {
            double v = Double.parseDouble(raw);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
