package com.mealvision.backend.mealphoto.nutrition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.nutrition.search")
public class NutritionSearchProperties {

    /** false：直接查備援表 */
    private boolean enabled = true;

    private String baseUrl = "https://api.tavily.com";

    /** 用環境變數帶入：TAVILY_API_KEY；沒設定不擋啟動，resolver 視為未設定 */
    private String apiKey;

    private int maxResults = 5;

    private String searchDepth = "advanced";

    private List<String> includeDomains = new ArrayList<>(List.of(
            "usda.gov",
            "nutritionix.com",
            "myfitnesspal.com",
            "fdc.nal.usda.gov",
            "eatthismuch.com",
            "calorieking.com"
    ));

    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(15);

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public int getMaxResults() { return maxResults; }
    public void setMaxResults(int maxResults) { this.maxResults = maxResults; }

    public String getSearchDepth() { return searchDepth; }
    public void setSearchDepth(String searchDepth) { this.searchDepth = searchDepth; }

    public List<String> getIncludeDomains() { return includeDomains; }
    public void setIncludeDomains(List<String> includeDomains) { this.includeDomains = includeDomains; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
}
