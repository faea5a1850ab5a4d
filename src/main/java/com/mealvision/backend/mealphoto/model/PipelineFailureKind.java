package com.mealvision.backend.mealphoto.model;

/**
 * 管線失敗分類。
 * 單一項目查不到營養不算失敗（只進 needsWebSearch 清單）。
 */
public enum PipelineFailureKind {
    /** 辨識不到任何可用項目 */
    RECOGNITION_FAILURE,
    /** 加總階段的內部錯誤 */
    AGGREGATION_FAILURE,
    /** 成功路徑的交易寫入失敗 */
    PERSISTENCE_FAILURE
}
