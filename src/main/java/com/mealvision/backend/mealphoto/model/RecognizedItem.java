package com.mealvision.backend.mealphoto.model;

/**
 * 模型辨識出的一個食物項目。
 * quantity 保留原始字串，需要數字時才用 {@link #quantityAsNumberOrNull()} 解析。
 */
public record RecognizedItem(
        String name,
        String quantity,
        String unit,
        String preparation,
        ConfidenceTier confidence
) {

    public static final String DEFAULT_NAME = "Unknown food";
    public static final String DEFAULT_UNIT = "grams";
    public static final String DEFAULT_PREPARATION = "unknown";
    public static final String PLACEHOLDER_NAME = "Unidentified food";

    public RecognizedItem {
        if (name == null || name.isBlank()) name = DEFAULT_NAME;
        if (quantity == null || quantity.isBlank()) quantity = "0";
        if (unit == null || unit.isBlank()) unit = DEFAULT_UNIT;
        if (preparation == null || preparation.isBlank()) preparation = DEFAULT_PREPARATION;
        if (confidence == null) confidence = ConfidenceTier.LOW;
    }

    /** 辨識失敗時給呼叫端的佔位項目 */
    public static RecognizedItem placeholder() {
        return new RecognizedItem(PLACEHOLDER_NAME, "0", DEFAULT_UNIT, DEFAULT_PREPARATION, ConfidenceTier.LOW);
    }

    public Double quantityAsNumberOrNull() {
        try {
            double v = Double.parseDouble(quantity.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
