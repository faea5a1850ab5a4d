package com.mealvision.backend.mealphoto.provider;

import com.mealvision.backend.mealphoto.image.PhotoPreparer;
import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import com.mealvision.backend.mealphoto.provider.config.GeminiProperties;
import com.mealvision.backend.mealphoto.storage.StorageService;
import com.mealvision.backend.testsupport.TestImages;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GeminiRecognitionClientTest {

    private static final String PATH = "/v1beta/models/gemini-test:generateContent";

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private final ObjectMapper om = new ObjectMapper();
    private StorageService storage;
    private ProviderTelemetry telemetry;
    private GeminiRecognitionClient client;

    private static RestClient restClientHttp11(String baseUrl) {
        // ✅ 避免 JDK HttpClient 走 h2c 導致 WireMock EOF
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(new JdkClientHttpRequestFactory(jdk))
                .build();
    }

    private static String geminiRespWithText(ObjectMapper om, String text, int p, int c, int t) throws Exception {
        ObjectNode root = om.createObjectNode();
        var parts = root.putArray("candidates").addObject().putObject("content").putArray("parts");
        parts.addObject().put("text", text);

        var usage = root.putObject("usageMetadata");
        usage.put("promptTokenCount", p);
        usage.put("candidatesTokenCount", c);
        usage.put("totalTokenCount", t);
        return om.writeValueAsString(root);
    }

    @BeforeEach
    void setUp() throws Exception {
        GeminiProperties props = new GeminiProperties();
        props.setEnabled(true);
        props.setApiKey("TEST_API_KEY");
        props.setModel("gemini-test");

        storage = mock(StorageService.class);
        when(storage.open(anyString())).thenAnswer(inv -> {
            byte[] png = TestImages.png(64, 48);
            return new StorageService.OpenResult(new ByteArrayInputStream(png), png.length, "image/png");
        });

        telemetry = mock(ProviderTelemetry.class);

        client = new GeminiRecognitionClient(
                restClientHttp11(wm.getRuntimeInfo().getHttpBaseUrl()),
                props, om, storage,
                new PhotoPreparer(2048),
                new RecognitionResponseParser(om),
                telemetry,
                "identify the food");
    }

    @Test
    void fenced_array_should_become_items_and_request_carries_jpeg_inline_data() throws Exception {
        String text = "```json\n[{\"name\":\"rice\",\"quantity\":\"200\",\"unit\":\"grams\",\"preparation\":\"steamed\",\"confidence\":\"high\"}]\n```";
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody(geminiRespWithText(om, text, 100, 20, 120))));

        RecognitionResult r = client.analyze("meals/lunch.png");

        assertThat(r.success()).isTrue();
        assertThat(r.items()).extracting(RecognizedItem::name).containsExactly("rice");
        assertThat(r.confidence()).isEqualTo(ConfidenceTier.HIGH);

        wm.verify(postRequestedFor(urlPathEqualTo(PATH))
                .withHeader("x-goog-api-key", equalTo("TEST_API_KEY"))
                .withRequestBody(matchingJsonPath("$.contents[0].parts[0].text", equalTo("identify the food")))
                .withRequestBody(matchingJsonPath("$.contents[0].parts[1].inlineData.mimeType", equalTo("image/jpeg")))
                .withRequestBody(matchingJsonPath("$.generationConfig.maxOutputTokens", equalTo("500"))));

        verify(telemetry).ok(eq("GEMINI"), eq("gemini-test"), eq("meals/lunch.png"), anyLong(), eq(100), eq(20), eq(120));
    }

    @Test
    void upstream_5xx_is_reported_with_code() {
        wm.stubFor(post(urlPathEqualTo(PATH)).willReturn(aResponse().withStatus(503)));

        RecognitionResult r = client.analyze("meals/lunch.png");

        assertThat(r.success()).isFalse();
        assertThat(r.error()).startsWith("Vision API error: [PROVIDER_UPSTREAM_5XX]");
        assertThat(r.items()).isEmpty();
        verify(telemetry).fail(eq("GEMINI"), eq("gemini-test"), anyString(), anyLong(), eq("PROVIDER_UPSTREAM_5XX"));
    }

    @Test
    void connection_fault_is_reported_as_vision_api_error() {
        wm.stubFor(post(urlPathEqualTo(PATH)).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        RecognitionResult r = client.analyze("meals/lunch.png");

        assertThat(r.success()).isFalse();
        assertThat(r.error()).startsWith("Vision API error: [");
        assertThat(r.items()).isEmpty();
    }

    @Test
    void missing_photo_never_calls_the_api() throws Exception {
        when(storage.open("missing.jpg")).thenThrow(new FileNotFoundException("Image file not found: missing.jpg"));

        RecognitionResult r = client.analyze("missing.jpg");

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo("Image file not found: missing.jpg");
        wm.verify(0, postRequestedFor(urlPathEqualTo(PATH)));
    }

    @Test
    void non_image_bytes_fail_before_the_call() throws Exception {
        when(storage.open("notes.txt")).thenReturn(
                new StorageService.OpenResult(new ByteArrayInputStream("hello".getBytes()), 5L, "text/plain"));

        RecognitionResult r = client.analyze("notes.txt");

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo("Failed to process image: UNSUPPORTED_IMAGE_FORMAT");
        wm.verify(0, postRequestedFor(urlPathEqualTo(PATH)));
    }

    @Test
    void no_candidates_is_empty_response() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"candidates\":[]}")));

        RecognitionResult r = client.analyze("meals/lunch.png");

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo("Empty response from Vision API");
    }
}
