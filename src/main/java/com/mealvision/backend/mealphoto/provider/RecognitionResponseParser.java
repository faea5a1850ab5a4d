package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 把模型的文字輸出轉成 {@link RecognitionResult}。
 * 預期格式：JSON array of {name, quantity, unit, preparation, confidence}，
 * 前後可能包 ```json fence。
 */
@Slf4j
public final class RecognitionResponseParser {

    static final String PARSE_ERROR_PREFIX = "Failed to parse Vision API response: ";
    private static final int PREVIEW_LEN = 200;

    private final ObjectMapper om;

    public RecognitionResponseParser(ObjectMapper om) {
        this.om = om;
    }

    public RecognitionResult parse(String content) {
        if (content == null || content.isBlank()) {
            return RecognitionResult.failed("Empty response from Vision API");
        }

        String payload = stripFence(content);

        JsonNode root;
        try {
            root = om.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("vision_json_parse_failed preview={}", safeOneLine200(content));
            return RecognitionResult.failedWithPlaceholder(PARSE_ERROR_PREFIX + e.getOriginalMessage());
        }

        if (root == null || !root.isArray()) {
            log.warn("vision_response_not_array preview={}", safeOneLine200(content));
            return RecognitionResult.failedWithPlaceholder(PARSE_ERROR_PREFIX + "Response is not a JSON array");
        }

        List<RecognizedItem> items = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            if (n == null || !n.isObject()) {
                log.warn("vision_item_skipped item={}", n);
                continue;
            }
            items.add(new RecognizedItem(
                    textOrNull(n.get("name")),
                    textOrNull(n.get("quantity")),
                    textOrNull(n.get("unit")),
                    textOrNull(n.get("preparation")),
                    ConfidenceTier.parseOrLow(textOrNull(n.get("confidence")))
            ));
        }

        if (items.isEmpty()) {
            return RecognitionResult.failedWithPlaceholder("No valid food items identified");
        }

        RecognitionResult ok = RecognitionResult.ok(items);
        log.info("vision_parsed items={} confidence={}", items.size(), ok.confidence().code());
        return ok;
    }

    /** 只剝開頭 ```json / ``` 與結尾 ```，其他不動 */
    static String stripFence(String raw) {
        String s = raw.trim();
        if (s.startsWith("```json")) s = s.substring(7);
        else if (s.startsWith("```")) s = s.substring(3);
        if (s.endsWith("```")) s = s.substring(0, s.length() - 3);
        return s.trim();
    }

    /** 數字也轉字串（quantity 常回 150 而不是 "150"） */
    private static String textOrNull(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (n.isContainerNode()) return null;
        String t = n.asText();
        return (t == null || t.isBlank()) ? null : t.trim();
    }

    static String safeOneLine200(String s) {
        if (s == null) return null;
        String t = s.replace("\r", " ").replace("\n", " ").trim();
        return (t.length() > PREVIEW_LEN) ? t.substring(0, PREVIEW_LEN) : t;
    }
}
