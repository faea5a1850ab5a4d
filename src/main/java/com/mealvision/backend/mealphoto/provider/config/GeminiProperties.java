package com.mealvision.backend.mealphoto.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.provider.gemini")
public class GeminiProperties {

    /** 開關：dev 沒 key 時走 stub（預設 false） */
    private boolean enabled = false;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String model = "gemini-2.0-flash";

    /** 用環境變數帶入：GEMINI_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    private int maxOutputTokens = 500;

    /** 低溫度讓辨識結果穩定 */
    private double temperature = 0.3;

    /** 指令文字；讀不到就用程式內建版本 */
    private String promptLocation = "classpath:prompts/vision_agent.txt";

    /** 長邊超過就縮圖 */
    private int maxImageDimension = 2048;

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxOutputTokens() { return maxOutputTokens; }
    public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public String getPromptLocation() { return promptLocation; }
    public void setPromptLocation(String promptLocation) { this.promptLocation = promptLocation; }

    public int getMaxImageDimension() { return maxImageDimension; }
    public void setMaxImageDimension(int maxImageDimension) { this.maxImageDimension = maxImageDimension; }
}
