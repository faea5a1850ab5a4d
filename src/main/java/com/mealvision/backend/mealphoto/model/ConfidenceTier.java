package com.mealvision.backend.mealphoto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

public enum ConfidenceTier {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String code;
    private final int score;

    ConfidenceTier(String code, int score) {
        this.code = code;
        this.score = score;
    }

    @JsonValue
    public String code() { return code; }

    public int score() { return score; }

    /** 無法辨識的值一律當 low（模型常亂回 "very high" / null） */
    @JsonCreator
    public static ConfidenceTier parseOrLow(String raw) {
        if (raw == null || raw.isBlank()) return LOW;
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (ConfidenceTier t : values()) {
            if (t.code.equals(s)) return t;
        }
        return LOW;
    }

    /**
     * 平均分數 >= 2.5 → high，>= 1.5 → medium，其餘 low。
     * 空集合視為 low。
     */
    public static ConfidenceTier fromMean(Collection<ConfidenceTier> tiers) {
        if (tiers == null || tiers.isEmpty()) return LOW;
        double sum = 0;
        for (ConfidenceTier t : tiers) sum += (t == null ? LOW : t).score;
        double avg = sum / tiers.size();
        if (avg >= 2.5) return HIGH;
        if (avg >= 1.5) return MEDIUM;
        return LOW;
    }
}
