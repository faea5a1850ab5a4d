package com.mealvision.backend.mealphoto.pipeline;

public enum PipelineStep {
    ANALYZE_PHOTO,
    SEARCH_NUTRITION,
    CALCULATE_TOTALS,
    CREATE_MEAL,
    HANDLE_ERROR;

    public boolean isTerminal() {
        return this == CREATE_MEAL || this == HANDLE_ERROR;
    }
}
