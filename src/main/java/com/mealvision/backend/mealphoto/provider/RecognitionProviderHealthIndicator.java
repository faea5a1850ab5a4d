package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.provider.config.GeminiProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 只檢查設定，不打外網。
 * enabled=true 但缺 key / baseUrl 不是 https / 沒有 model → DOWN。
 */
@Component
@ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
public class RecognitionProviderHealthIndicator implements HealthIndicator {

    private final GeminiProperties props;

    public RecognitionProviderHealthIndicator(GeminiProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        String apiKey = props.getApiKey();
        String baseUrl = props.getBaseUrl();
        String model = props.getModel();

        Health.Builder b;
        if (apiKey == null || apiKey.isBlank()) {
            b = Health.down().withDetail("reason", "GEMINI_API_KEY_MISSING");
        } else if (baseUrl == null || !baseUrl.toLowerCase(Locale.ROOT).startsWith("https://")) {
            b = Health.down().withDetail("reason", "GEMINI_BASE_URL_INVALID");
        } else if (model == null || model.isBlank()) {
            b = Health.down().withDetail("reason", "GEMINI_MODEL_MISSING");
        } else {
            b = Health.up();
        }

        // apiKey 不輸出
        return b.withDetail("provider", "GEMINI")
                .withDetail("model", model == null ? "" : model)
                .withDetail("maxImageDimension", props.getMaxImageDimension())
                .build();
    }
}
