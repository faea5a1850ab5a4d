package com.mealvision.backend.mealphoto.service;

import com.mealvision.backend.mealphoto.model.MealPhotoRequest;
import com.mealvision.backend.mealphoto.model.MealPhotoResult;
import com.mealvision.backend.mealphoto.pipeline.MealPhotoPipeline;
import com.mealvision.backend.mealphoto.pipeline.PipelineState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * 一張照片跑一次 pipeline。
 * 除了輸入缺欄位（IllegalArgumentException）之外，一律回結構化結果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MealPhotoAnalysisService {

    private final MealPhotoPipeline pipeline;

    /** 丟到 mealPhotoExecutor；輸入不合法時 future 以 IllegalArgumentException 結束 */
    @Async("mealPhotoExecutor")
    public CompletableFuture<MealPhotoResult> analyze(Long userId, MealPhotoRequest request) {
        return CompletableFuture.completedFuture(analyzeNow(userId, request));
    }

    public MealPhotoResult analyzeNow(Long userId, MealPhotoRequest request) {
        validate(request);
        log.info("meal_photo_start userId={} dayId={} photoPath={}",
                userId, request.dayId(), request.photoPath());

        try {
            PipelineState done = pipeline.run(PipelineState.initial(userId, request));
            MealPhotoResult result = toResult(done);
            if (result.success()) {
                log.info("meal_photo_ok userId={} dayId={} mealId={}", userId, request.dayId(), result.mealId());
            } else {
                log.warn("meal_photo_failed userId={} dayId={} kind={} error={} mealId={}",
                        userId, request.dayId(), result.failureKind(), result.error(), result.mealId());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("meal_photo_workflow_error userId={} dayId={}", userId, request.dayId(), e);
            return MealPhotoResult.workflowFailed("Workflow execution failed: " + e.getMessage());
        }
    }

    static void validate(MealPhotoRequest request) {
        if (request == null || request.dayId() == null) {
            throw new IllegalArgumentException("Missing required field: dayId");
        }
        if (request.photoPath() == null || request.photoPath().isBlank()) {
            throw new IllegalArgumentException("Missing required field: photoPath");
        }
    }

    static MealPhotoResult toResult(PipelineState s) {
        return new MealPhotoResult(
                s.isSuccess(),
                s.getMealId(),
                s.isSuccess() ? null : s.getError(),
                s.isSuccess() ? null : s.getFailureKind(),
                s.isSuccess() ? null : s.getPartialResults(),
                s.getConfidence(),
                s.getRecognizedItems(),
                s.getNutritionData()
        );
    }
}
