package com.mealvision.backend.mealphoto.nutrition.search;

import com.mealvision.backend.mealphoto.nutrition.config.NutritionSearchProperties;
import com.mealvision.backend.mealphoto.provider.ProviderErrorMapper;
import com.mealvision.backend.mealphoto.provider.ProviderTelemetry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class TavilySearchClient implements NutritionSearchClient {

    private static final String PROVIDER = "TAVILY";

    private final RestClient http;
    private final NutritionSearchProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public TavilySearchClient(RestClient http,
                              NutritionSearchProperties props,
                              ObjectMapper om,
                              ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public boolean isConfigured() {
        return props.isEnabled() && props.hasApiKey();
    }

    @Override
    public List<SearchHit> search(String query) {
        if (!props.hasApiKey()) throw new IllegalStateException("TAVILY_API_KEY_MISSING");

        long t0 = System.nanoTime();
        JsonNode resp;
        try {
            resp = http.post()
                    .uri("/search")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey().trim())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(buildRequest(query))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            telemetry.fail(PROVIDER, props.getSearchDepth(), query, ProviderTelemetry.msSince(t0),
                    ProviderErrorMapper.map(e).code());
            throw e;
        }
        telemetry.ok(PROVIDER, query, ProviderTelemetry.msSince(t0));

        JsonNode results = resp == null ? null : resp.path("results");
        if (results == null || !results.isArray()) return List.of();

        List<SearchHit> hits = new ArrayList<>(results.size());
        for (JsonNode r : results) {
            hits.add(new SearchHit(r.path("url").asText(""), r.path("content").asText("")));
        }
        return hits;
    }

    private ObjectNode buildRequest(String query) {
        ObjectNode root = om.createObjectNode();
        root.put("query", query);
        root.put("search_depth", props.getSearchDepth());
        root.put("max_results", props.getMaxResults());
        ArrayNode domains = root.putArray("include_domains");
        if (props.getIncludeDomains() != null) {
            props.getIncludeDomains().forEach(domains::add);
        }
        return root;
    }
}
