package com.mealvision.backend.mealphoto.nutrition.config;

import com.mealvision.backend.mealphoto.nutrition.cache.CaffeineNutritionCache;
import com.mealvision.backend.mealphoto.nutrition.cache.NutritionCache;
import com.mealvision.backend.mealphoto.nutrition.search.NutritionSearchClient;
import com.mealvision.backend.mealphoto.nutrition.search.TavilySearchClient;
import com.mealvision.backend.mealphoto.provider.ProviderTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(NutritionSearchProperties.class)
public class NutritionConfig {

    @Bean("tavilyRestClient")
    public RestClient tavilyRestClient(NutritionSearchProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .build();
    }

    @Bean
    public NutritionSearchClient nutritionSearchClient(
            @Qualifier("tavilyRestClient") RestClient http,
            NutritionSearchProperties props,
            ObjectMapper om,
            ProviderTelemetry telemetry
    ) {
        // key 缺失不擋啟動：resolver 會直接走備援表
        if (props.isEnabled() && !props.hasApiKey()) {
            log.warn("nutrition_search_unconfigured reason=TAVILY_API_KEY_MISSING");
        }
        return new TavilySearchClient(http, props, om, telemetry);
    }

    @Bean("nutritionCacheManager")
    public CacheManager nutritionCacheManager(@Value("${app.nutrition.cache.max-size:10000}") long maxSize) {
        CaffeineCacheManager mgr = new CaffeineCacheManager(CaffeineNutritionCache.CACHE_NAME);
        // 不設 TTL：營養資料不會變，只靠上限淘汰
        mgr.setCaffeine(Caffeine.newBuilder().maximumSize(maxSize));
        mgr.setAllowNullValues(false);
        return mgr;
    }

    @Bean
    public NutritionCache nutritionCache(@Qualifier("nutritionCacheManager") CacheManager cacheManager) {
        return new CaffeineNutritionCache(cacheManager);
    }
}
