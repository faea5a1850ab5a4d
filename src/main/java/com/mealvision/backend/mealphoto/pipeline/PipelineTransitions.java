package com.mealvision.backend.mealphoto.pipeline;

/**
 * 純函式路由：(目前步驟, 步驟跑完後的 state) → 下一步。
 * 不碰任何外部資源，可以單獨測。
 */
public final class PipelineTransitions {

    static final String NO_ITEMS = "No food items recognized in photo";
    static final String NO_TOTALS = "Failed to calculate nutrition totals";

    private PipelineTransitions() {}

    public static PipelineStep next(PipelineStep current, PipelineState state) {
        return switch (current) {
            case ANALYZE_PHOTO -> afterAnalyze(state);
            case SEARCH_NUTRITION -> PipelineStep.CALCULATE_TOTALS;
            case CALCULATE_TOTALS -> afterCalculate(state);
            case CREATE_MEAL, HANDLE_ERROR -> throw new IllegalStateException("TERMINAL_STEP: " + current);
        };
    }

    /** 轉到 HANDLE_ERROR 但 state 沒有錯誤訊息時要補上的文字 */
    public static String routingError(PipelineStep from) {
        return from == PipelineStep.CALCULATE_TOTALS ? NO_TOTALS : NO_ITEMS;
    }

    private static PipelineStep afterAnalyze(PipelineState s) {
        if (s.hasError()) return PipelineStep.HANDLE_ERROR;
        if (s.hasRecognizedItems()) {
            // 已經帶著營養資料重新進來的 state 不用再查
            return s.getNutritionData().isEmpty()
                    ? PipelineStep.SEARCH_NUTRITION
                    : PipelineStep.CALCULATE_TOTALS;
        }
        return PipelineStep.HANDLE_ERROR;
    }

    private static PipelineStep afterCalculate(PipelineState s) {
        if (s.hasError() || s.getTotals() == null) return PipelineStep.HANDLE_ERROR;
        return PipelineStep.CREATE_MEAL;
    }
}
