package com.mealvision.backend.mealphoto.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Slf4j
public final class VisionPromptLoader {

    static final String FALLBACK_PROMPT =
            "You are a food recognition expert. Analyze this meal photo and identify all food items.\n"
            + "Return ONLY a JSON array with food items including name, quantity, unit, preparation, and confidence.";

    private VisionPromptLoader() {}

    /** 讀不到或是空檔都回內建 prompt，不讓啟動失敗 */
    public static String load(ResourceLoader loader, String location) {
        if (location == null || location.isBlank()) return FALLBACK_PROMPT;
        try {
            Resource r = loader.getResource(location);
            if (!r.exists()) {
                log.warn("vision_prompt_missing location={}", location);
                return FALLBACK_PROMPT;
            }
            try (InputStream in = r.getInputStream()) {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
                return text.isEmpty() ? FALLBACK_PROMPT : text;
            }
        } catch (Exception e) {
            log.error("vision_prompt_load_failed location={}", location, e);
            return FALLBACK_PROMPT;
        }
    }
}
