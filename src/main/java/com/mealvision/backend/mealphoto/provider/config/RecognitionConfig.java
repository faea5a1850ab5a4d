package com.mealvision.backend.mealphoto.provider.config;

import com.mealvision.backend.mealphoto.image.PhotoPreparer;
import com.mealvision.backend.mealphoto.provider.GeminiRecognitionClient;
import com.mealvision.backend.mealphoto.provider.ProviderTelemetry;
import com.mealvision.backend.mealphoto.provider.RecognitionClient;
import com.mealvision.backend.mealphoto.provider.RecognitionResponseParser;
import com.mealvision.backend.mealphoto.provider.StubRecognitionClient;
import com.mealvision.backend.mealphoto.provider.VisionPromptLoader;
import com.mealvision.backend.mealphoto.storage.StorageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class RecognitionConfig {

    /** ✅ 只有 enabled=false 才給 stub，避免 RecognitionClient 兩個 Bean */
    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "false", matchIfMissing = true)
    public RecognitionClient stubRecognitionClient(StorageService storage) {
        return new StubRecognitionClient(storage);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RestClient geminiRestClient(GeminiProperties props) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RecognitionClient geminiRecognitionClient(
            RestClient geminiRestClient,
            GeminiProperties props,
            ObjectMapper om,
            StorageService storage,
            ProviderTelemetry telemetry,
            ResourceLoader resourceLoader
    ) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("GEMINI_BASE_URL_MISSING");

        String prompt = VisionPromptLoader.load(resourceLoader, props.getPromptLocation());
        return new GeminiRecognitionClient(
                geminiRestClient, props, om, storage,
                new PhotoPreparer(props.getMaxImageDimension()),
                new RecognitionResponseParser(om),
                telemetry, prompt);
    }
}
