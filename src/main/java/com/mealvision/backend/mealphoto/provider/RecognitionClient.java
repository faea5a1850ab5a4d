package com.mealvision.backend.mealphoto.provider;

/**
 * 照片 → 候選食物清單。
 * 預期內的失敗（檔案不存在、模型回傳壞掉、HTTP 錯誤）都包成 failure 回傳，不丟例外。
 */
public interface RecognitionClient {

    String providerCode();

    RecognitionResult analyze(String photoPath);
}
