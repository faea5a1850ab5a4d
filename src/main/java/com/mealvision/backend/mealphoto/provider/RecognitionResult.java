package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.RecognizedItem;

import java.util.List;

public record RecognitionResult(
        boolean success,
        List<RecognizedItem> items,
        ConfidenceTier confidence,
        String error
) {

    public RecognitionResult {
        items = items == null ? List.of() : List.copyOf(items);
        if (confidence == null) confidence = ConfidenceTier.LOW;
    }

    public static RecognitionResult ok(List<RecognizedItem> items) {
        return new RecognitionResult(true, items, ConfidenceTier.fromMean(
                items.stream().map(RecognizedItem::confidence).toList()), null);
    }

    public static RecognitionResult failed(String error) {
        return new RecognitionResult(false, List.of(), ConfidenceTier.LOW, error);
    }

    /** 回應壞掉時仍給一個佔位項目，方便需要非空清單的呼叫端 */
    public static RecognitionResult failedWithPlaceholder(String error) {
        return new RecognitionResult(false, List.of(RecognizedItem.placeholder()), ConfidenceTier.LOW, error);
    }
}
