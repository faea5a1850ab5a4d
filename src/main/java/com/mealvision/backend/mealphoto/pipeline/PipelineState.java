package com.mealvision.backend.mealphoto.pipeline;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.MealPhotoRequest;
import com.mealvision.backend.mealphoto.model.NutritionEntry;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.PartialResults;
import com.mealvision.backend.mealphoto.model.PipelineFailureKind;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次 pipeline 執行的狀態。不可變：每個步驟用 toBuilder() 產生新的 state。
 */
@Value
@Builder(toBuilder = true)
public class PipelineState {

    // identity / input
    Long userId;
    Long dayId;
    String photoPath;
    String category;

    // intermediates
    @Builder.Default
    List<RecognizedItem> recognizedItems = List.of();
    @Builder.Default
    List<NutritionEntry> nutritionData = List.of();
    @Builder.Default
    List<String> needsWebSearch = List.of();

    // outputs
    NutritionFacts totals;
    Long mealId;
    boolean success;
    String error;
    PipelineFailureKind failureKind;
    PartialResults partialResults;
    @Builder.Default
    ConfidenceTier confidence = ConfidenceTier.LOW;

    public static PipelineState initial(Long userId, MealPhotoRequest request) {
        return PipelineState.builder()
                .userId(userId)
                .dayId(request.dayId())
                .photoPath(request.photoPath())
                .category(request.category())
                .build();
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean hasRecognizedItems() {
        return recognizedItems != null && !recognizedItems.isEmpty();
    }

    public PartialResults snapshot() {
        return new PartialResults(recognizedItems, nutritionData, needsWebSearch, confidence);
    }
}
