package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.image.PhotoPreparer;
import com.mealvision.backend.mealphoto.provider.config.GeminiProperties;
import com.mealvision.backend.mealphoto.storage.StorageService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;

/**
 * Gemini generateContent：照片（JPEG base64）+ 指令文字 → JSON array 文字 → {@link RecognitionResult}。
 * 每一種失敗都轉成帶前綴的錯誤訊息，不往外丟。
 */
@Slf4j
public class GeminiRecognitionClient implements RecognitionClient {

    private static final String PROVIDER = "GEMINI";
    private static final String SYSTEM_TEXT = "Return ONLY a JSON array. No extra text.";

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;
    private final StorageService storage;
    private final PhotoPreparer preparer;
    private final RecognitionResponseParser parser;
    private final ProviderTelemetry telemetry;
    private final String prompt;

    public GeminiRecognitionClient(RestClient http,
                                   GeminiProperties props,
                                   ObjectMapper om,
                                   StorageService storage,
                                   PhotoPreparer preparer,
                                   RecognitionResponseParser parser,
                                   ProviderTelemetry telemetry,
                                   String prompt) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.storage = storage;
        this.preparer = preparer;
        this.parser = parser;
        this.telemetry = telemetry;
        this.prompt = prompt;
    }

    @Override
    public String providerCode() {
        return PROVIDER;
    }

    @Override
    public RecognitionResult analyze(String photoPath) {
        // 1) 讀檔
        byte[] original;
        try {
            original = readAll(photoPath);
        } catch (FileNotFoundException e) {
            log.warn("vision_photo_missing photoPath={}", photoPath);
            return RecognitionResult.failed(e.getMessage());
        } catch (Exception e) {
            log.warn("vision_photo_read_failed photoPath={} err={}", photoPath, e.toString());
            return RecognitionResult.failed("Failed to process image: " + safeMsg(e));
        }

        // 2) 轉 JPEG + 縮圖
        PhotoPreparer.PreparedPhoto photo;
        try {
            photo = preparer.prepare(original);
        } catch (IllegalArgumentException | IOException e) {
            log.warn("vision_photo_prepare_failed photoPath={} err={}", photoPath, e.getMessage());
            return RecognitionResult.failed("Failed to process image: " + safeMsg(e));
        }

        // 3) 呼叫模型
        String modelId = props.getModel();
        long t0 = System.nanoTime();
        JsonNode resp;
        try {
            resp = callGenerateContent(photo.bytes(), photo.mimeType(), modelId);
        } catch (RestClientException | IllegalStateException e) {
            ProviderErrorMapper.Mapped mapped = ProviderErrorMapper.map(e);
            telemetry.fail(PROVIDER, modelId, photoPath, ProviderTelemetry.msSince(t0), mapped.code());
            return RecognitionResult.failed("Vision API error: [" + mapped.code() + "] " + mapped.message());
        } catch (RuntimeException e) {
            telemetry.fail(PROVIDER, modelId, photoPath, ProviderTelemetry.msSince(t0), "PROVIDER_FAILED");
            log.error("vision_unexpected_error photoPath={}", photoPath, e);
            return RecognitionResult.failed("Unexpected error: " + safeMsg(e));
        }

        JsonNode usage = resp == null ? null : resp.path("usageMetadata");
        telemetry.ok(PROVIDER, modelId, photoPath, ProviderTelemetry.msSince(t0),
                intOrNull(usage, "promptTokenCount"),
                intOrNull(usage, "candidatesTokenCount"),
                intOrNull(usage, "totalTokenCount"));

        // 4) 解析
        String text = extractJoinedTextOrNull(resp);
        log.debug("vision_text_preview photoPath={} preview={}",
                photoPath, RecognitionResponseParser.safeOneLine200(text));
        return parser.parse(text);
    }

    private byte[] readAll(String photoPath) throws Exception {
        StorageService.OpenResult opened = storage.open(photoPath);
        try (InputStream in = opened.inputStream()) {
            return in.readAllBytes();
        }
    }

    private JsonNode callGenerateContent(byte[] imageBytes, String mimeType, String modelId) {
        ObjectNode req = buildRequest(imageBytes, mimeType);
        return http.post()
                .uri("/v1beta/models/{model}:generateContent", modelId)
                .header("x-goog-api-key", requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);
    }

    private ObjectNode buildRequest(byte[] imageBytes, String mimeType) {
        ObjectNode root = om.createObjectNode();

        ObjectNode sys = root.putObject("systemInstruction");
        sys.putArray("parts").addObject().put("text", SYSTEM_TEXT);

        ArrayNode contents = root.putArray("contents");
        ObjectNode c0 = contents.addObject();
        c0.put("role", "user");
        ArrayNode parts = c0.putArray("parts");
        parts.addObject().put("text", prompt);

        ObjectNode inline = parts.addObject().putObject("inlineData");
        inline.put("mimeType", mimeType);
        inline.put("data", Base64.getEncoder().encodeToString(imageBytes));

        ObjectNode gen = root.putObject("generationConfig");
        gen.put("maxOutputTokens", props.getMaxOutputTokens());
        gen.put("temperature", props.getTemperature());
        return root;
    }

    static String extractJoinedTextOrNull(JsonNode resp) {
        if (resp == null || resp.isNull()) return null;
        JsonNode parts = resp.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return null;

        StringBuilder sb = new StringBuilder(256);
        for (JsonNode p : parts) {
            String t = p.path("text").asText(null);
            if (t != null) sb.append(t);
        }
        String joined = sb.toString().trim();
        return joined.isEmpty() ? null : joined;
    }

    private static Integer intOrNull(JsonNode usage, String field) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) return null;
        JsonNode n = usage.path(field);
        return n.isInt() ? n.asInt() : null;
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        return k.trim();
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
