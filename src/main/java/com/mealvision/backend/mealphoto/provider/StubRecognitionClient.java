package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import com.mealvision.backend.mealphoto.storage.StorageService;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.util.List;

/** 本機沒有 key 時用：確認照片打得開，回固定的一個項目 */
@Slf4j
public class StubRecognitionClient implements RecognitionClient {

    private final StorageService storage;

    public StubRecognitionClient(StorageService storage) {
        this.storage = storage;
    }

    @Override
    public String providerCode() {
        return "STUB";
    }

    @Override
    public RecognitionResult analyze(String photoPath) {
        try (InputStream in = storage.open(photoPath).inputStream()) {
            // 只讀檔頭確認可讀
            in.read();
        } catch (FileNotFoundException e) {
            return RecognitionResult.failed(e.getMessage());
        } catch (Exception e) {
            log.warn("stub_photo_read_failed photoPath={} err={}", photoPath, e.toString());
            return RecognitionResult.failed("Failed to process image: " + e.getMessage());
        }

        return RecognitionResult.ok(List.of(
                new RecognizedItem("rice", "200", "grams", "steamed", ConfidenceTier.MEDIUM)
        ));
    }
}
