package com.mealvision.backend.mealphoto.pipeline;

import com.mealvision.backend.mealphoto.aggregate.NutritionAggregator;
import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.NutritionEntry;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import com.mealvision.backend.mealphoto.model.PipelineFailureKind;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import com.mealvision.backend.mealphoto.nutrition.NutritionResolver;
import com.mealvision.backend.mealphoto.provider.RecognitionClient;
import com.mealvision.backend.mealphoto.provider.RecognitionResult;
import com.mealvision.backend.mealphoto.service.MealPersistenceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 照片 → 辨識 → 查營養 → 加總 → 寫入。
 * 路由交給 {@link PipelineTransitions}；每一步的例外都在這裡接住寫進 error，絕不往外丟。
 * 同一次執行內完全序列化：第 i 項查完（含寫快取）才查第 i+1 項。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MealPhotoPipeline {

    private final RecognitionClient recognition;
    private final NutritionResolver resolver;
    private final NutritionAggregator aggregator;
    private final MealPersistenceGateway gateway;

    public PipelineState run(PipelineState initial) {
        PipelineState state = initial;
        PipelineStep step = PipelineStep.ANALYZE_PHOTO;

        while (true) {
            state = execute(step, state);
            if (step.isTerminal()) {
                log.info("pipeline_done step={} dayId={} success={} mealId={} error={}",
                        step, state.getDayId(), state.isSuccess(), state.getMealId(), state.getError());
                return state;
            }

            PipelineStep next = PipelineTransitions.next(step, state);
            if (next == PipelineStep.HANDLE_ERROR && !state.hasError()) {
                state = state.toBuilder().error(PipelineTransitions.routingError(step)).build();
            }
            log.info("pipeline_step step={} dayId={} next={}", step, state.getDayId(), next);
            step = next;
        }
    }

    private PipelineState execute(PipelineStep step, PipelineState s) {
        try {
            return switch (step) {
                case ANALYZE_PHOTO -> analyzePhoto(s);
                case SEARCH_NUTRITION -> searchNutrition(s);
                case CALCULATE_TOTALS -> calculateTotals(s);
                case CREATE_MEAL -> createMeal(s);
                case HANDLE_ERROR -> handleError(s);
            };
        } catch (RuntimeException e) {
            log.error("pipeline_step_failed step={} dayId={}", step, s.getDayId(), e);
            PipelineState failed = s.toBuilder().error(stepErrorPrefix(step) + e.getMessage()).build();
            // 終止步驟自己炸了就直接收尾，不再重跑
            return step.isTerminal() ? finishFailed(failed) : failed;
        }
    }

    PipelineState analyzePhoto(PipelineState s) {
        RecognitionResult r = recognition.analyze(s.getPhotoPath());
        if (!r.success()) {
            // 失敗時的佔位項目只給需要非空清單的呼叫端，不當成辨識結果
            log.warn("photo_analysis_failed dayId={} provider={} error={}",
                    s.getDayId(), recognition.providerCode(), r.error());
            return s.toBuilder()
                    .error(r.error() == null ? "Photo analysis failed" : r.error())
                    .build();
        }
        log.info("photo_analysis_ok dayId={} items={} confidence={}",
                s.getDayId(), r.items().size(), r.confidence().code());
        return s.toBuilder()
                .recognizedItems(r.items())
                .confidence(r.confidence())
                .build();
    }

    PipelineState searchNutrition(PipelineState s) {
        List<NutritionEntry> entries = new ArrayList<>(s.getRecognizedItems().size());
        List<String> needsWebSearch = new ArrayList<>();

        for (RecognizedItem item : s.getRecognizedItems()) {
            try {
                NutritionLookupResult r = resolver.resolve(item.name(), item.quantity(), item.unit());
                if (r.success()) {
                    entries.add(new NutritionEntry(item, r.nutrition(), r.source(), r.confidence()));
                } else {
                    needsWebSearch.add(item.name());
                    entries.add(NutritionEntry.placeholder(item));
                }
            } catch (RuntimeException e) {
                // 單一項目失敗不影響整餐：補 0 並列入待補清單
                log.warn("nutrition_item_failed dayId={} name={} err={}", s.getDayId(), item.name(), e.toString());
                needsWebSearch.add(item.name());
                entries.add(NutritionEntry.placeholder(item));
            }
        }

        log.info("nutrition_search_done dayId={} resolved={}/{}",
                s.getDayId(), entries.size() - needsWebSearch.size(), entries.size());
        return s.toBuilder()
                .nutritionData(entries)
                .needsWebSearch(needsWebSearch)
                .build();
    }

    PipelineState calculateTotals(PipelineState s) {
        NutritionFacts totals = aggregator.sum(s.getNutritionData());
        return s.toBuilder().totals(totals).build();
    }

    PipelineState createMeal(PipelineState s) {
        try {
            Long mealId = gateway.saveCompleted(s);
            return s.toBuilder()
                    .mealId(mealId)
                    .success(true)
                    .build();
        } catch (RuntimeException e) {
            // 已經寫失敗一次，不再嘗試補救寫入
            log.error("meal_create_failed dayId={}", s.getDayId(), e);
            return s.toBuilder()
                    .success(false)
                    .error("Database error: " + e.getMessage())
                    .failureKind(PipelineFailureKind.PERSISTENCE_FAILURE)
                    .partialResults(s.snapshot())
                    .build();
        }
    }

    PipelineState handleError(PipelineState s) {
        log.warn("pipeline_handle_error dayId={} error={}", s.getDayId(), s.getError());
        PipelineState failed = finishFailed(s);

        if (!failed.hasRecognizedItems()) return failed;

        try {
            Long mealId = gateway.saveNeedsReview(failed);
            return failed.toBuilder().mealId(mealId).build();
        } catch (RuntimeException e) {
            // 補救寫入失敗只留 log；partialResults 已經在 state 上
            log.warn("partial_save_failed dayId={} err={}", s.getDayId(), e.toString());
            return failed;
        }
    }

    private static PipelineState finishFailed(PipelineState s) {
        PipelineFailureKind kind = s.getFailureKind();
        if (kind == null) {
            kind = s.hasRecognizedItems()
                    ? PipelineFailureKind.AGGREGATION_FAILURE
                    : PipelineFailureKind.RECOGNITION_FAILURE;
        }
        return s.toBuilder()
                .success(false)
                .failureKind(kind)
                .partialResults(s.snapshot())
                .confidence(s.getConfidence() == null ? ConfidenceTier.LOW : s.getConfidence())
                .build();
    }

    private static String stepErrorPrefix(PipelineStep step) {
        return switch (step) {
            case ANALYZE_PHOTO -> "Photo analysis error: ";
            case SEARCH_NUTRITION -> "Nutrition search error: ";
            case CALCULATE_TOTALS -> "Failed to calculate totals: ";
            case CREATE_MEAL -> "Database error: ";
            case HANDLE_ERROR -> "Error handling failed: ";
        };
    }
}
