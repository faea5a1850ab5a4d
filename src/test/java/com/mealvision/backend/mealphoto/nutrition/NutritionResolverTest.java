package com.mealvision.backend.mealphoto.nutrition;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.NutritionLookupResult;
import com.mealvision.backend.mealphoto.nutrition.cache.NutritionCache;
import com.mealvision.backend.mealphoto.nutrition.search.NutritionSearchClient;
import com.mealvision.backend.mealphoto.nutrition.search.SearchHit;
import com.mealvision.backend.testsupport.InMemoryNutritionCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class NutritionResolverTest {

    private static final String USDA = "https://fdc.nal.usda.gov/fdc-app.html#/food-details/171477";
    private static final String NUTRITIONIX = "https://www.nutritionix.com/food/chicken-breast";
    private static final String BLOG = "https://www.eatthismuch.com/food/nutrition/chicken-breast";

    private NutritionSearchClient search;
    private InMemoryNutritionCache cache;
    private NutritionResolver resolver;

    @BeforeEach
    void setUp() {
        search = mock(NutritionSearchClient.class);
        cache = new InMemoryNutritionCache();
        resolver = new NutritionResolver(search, cache);
    }

    // ===== search disabled → backup table =====

    @Test
    void chicken_breast_200g_scales_backup_values_linearly() {
        when(search.isConfigured()).thenReturn(false);

        NutritionLookupResult r = resolver.resolve("chicken breast", "200", "grams");

        assertThat(r.success()).isTrue();
        assertThat(r.nutrition().calories()).isEqualTo(330.0);
        assertThat(r.nutrition().protein()).isEqualTo(62.0);
        assertThat(r.nutrition().fat()).isEqualTo(7.2);
        assertThat(r.nutrition().sodium()).isEqualTo(148.0);
        assertThat(r.servingSize()).isEqualTo("200grams");
        verify(search, never()).search(anyString());
    }

    @Test
    void banana_without_search_is_estimated_low() {
        when(search.isConfigured()).thenReturn(false);

        NutritionLookupResult r = resolver.resolve("banana", null, null);

        assertThat(r.success()).isTrue();
        assertThat(r.source()).isEqualTo("estimated");
        assertThat(r.confidence()).isEqualTo(ConfidenceTier.LOW);
        assertThat(r.nutrition().calories()).isEqualTo(89.0);
        assertThat(r.servingSize()).isEqualTo("100g");
        assertThat(r.error()).isEqualTo(NutritionResolver.BACKUP_NOTE);
    }

    @Test
    void backup_match_is_bidirectional_substring() {
        when(search.isConfigured()).thenReturn(false);

        assertThat(resolver.resolve("Grilled Salmon Fillet", null, null).nutrition().calories()).isEqualTo(208.0);
        assertThat(resolver.resolve("chicken", null, null).nutrition().calories()).isEqualTo(165.0);
    }

    @Test
    void unknown_food_returns_all_zero_failure() {
        when(search.isConfigured()).thenReturn(false);

        NutritionLookupResult r = resolver.resolve("quinoa salad", "150", "grams");

        assertThat(r.success()).isFalse();
        assertThat(r.nutrition()).isEqualTo(NutritionFacts.ZERO);
        assertThat(r.source()).isEqualTo("none");
        assertThat(r.confidence()).isEqualTo(ConfidenceTier.LOW);
        assertThat(r.error()).isEqualTo("No nutrition data found");
    }

    @Test
    void backup_results_are_never_cached() {
        when(search.isConfigured()).thenReturn(false);

        resolver.resolve("banana", "120", "g");
        resolver.resolve("quinoa salad", null, null);

        assertThat(cache.size()).isZero();
    }

    @Test
    void unparseable_quantity_skips_scaling() {
        when(search.isConfigured()).thenReturn(false);

        NutritionLookupResult r = resolver.resolve("rice", "a bowl", "grams");

        assertThat(r.success()).isTrue();
        assertThat(r.nutrition().calories()).isEqualTo(130.0);
        assertThat(r.servingSize()).isEqualTo("100g");
    }

    @Test
    void non_gram_unit_is_not_scaled() {
        when(search.isConfigured()).thenReturn(false);

        NutritionLookupResult r = resolver.resolve("egg", "2", "pieces");

        assertThat(r.nutrition().calories()).isEqualTo(155.0);
    }

    // ===== search configured =====

    @Test
    void search_success_is_scaled_and_cached_then_served_from_cache() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenReturn(List.of(
                new SearchHit(USDA, "Per 100g: 165 calories, 31g protein, 3.6g fat, 74mg sodium")
        ));

        NutritionLookupResult first = resolver.resolve("Chicken Breast", "200", "grams");
        NutritionLookupResult second = resolver.resolve("Chicken Breast", "200", "grams");

        assertThat(first.success()).isTrue();
        assertThat(first.source()).isEqualTo(USDA);
        assertThat(first.confidence()).isEqualTo(ConfidenceTier.HIGH);
        assertThat(first.nutrition().calories()).isEqualTo(330.0);
        assertThat(first.nutrition().protein()).isEqualTo(62.0);
        assertThat(first.nutrition().fat()).isEqualTo(7.2);
        // 沒抓到的營養素補 0
        assertThat(first.nutrition().carbs()).isZero();

        assertThat(second).isEqualTo(first);
        verify(search, times(1)).search(anyString());
        assertThat(cache.containsKey("chicken breast_200_grams")).isTrue();
    }

    @Test
    void query_appends_quantity_and_unit() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenReturn(List.of());

        resolver.resolve("rice", "200", "grams");

        verify(search).search("rice nutrition facts calories protein carbs fat per 200 grams");
        assertThat(NutritionResolver.buildQuery("rice", null, "grams"))
                .isEqualTo("rice nutrition facts calories protein carbs fat");
    }

    @Test
    void first_high_confidence_candidate_wins_even_after_a_usable_low_one() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenReturn(List.of(
                new SearchHit(BLOG, "100 calories, 10g protein, 5g fat"),
                new SearchHit(USDA, "165 calories, 31g protein, 3.6g fat, 0g carbs"),
                new SearchHit("https://www.usda.gov/other", "999 calories, 99g protein, 99g fat")
        ));

        NutritionLookupResult r = resolver.resolve("chicken breast", null, null);

        assertThat(r.source()).isEqualTo(USDA);
        assertThat(r.nutrition().calories()).isEqualTo(165.0);
        assertThat(r.servingSize()).isEqualTo("100g");
    }

    @Test
    void without_high_candidate_the_first_usable_one_is_kept() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenReturn(List.of(
                new SearchHit(NUTRITIONIX, "120 calories, 22g protein"),
                new SearchHit(BLOG, "150 calories, 28g protein, 3g fat"),
                new SearchHit(NUTRITIONIX, "160 calories, 30g protein, 3.5g fat, 0g carbs")
        ));

        NutritionLookupResult r = resolver.resolve("chicken breast", null, null);

        // 第一筆只有 2 個營養素，不可用
        assertThat(r.source()).isEqualTo(BLOG);
        assertThat(r.confidence()).isEqualTo(ConfidenceTier.LOW);
        assertThat(r.nutrition().calories()).isEqualTo(150.0);
    }

    @Test
    void nothing_parsable_falls_back_to_backup() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenReturn(List.of(
                new SearchHit(USDA, "Apples are a great snack with 52 calories")
        ));

        NutritionLookupResult r = resolver.resolve("apple", null, null);

        assertThat(r.source()).isEqualTo("estimated");
        assertThat(r.nutrition().calories()).isEqualTo(52.0);
        assertThat(cache.size()).isZero();
    }

    @Test
    void search_transport_error_falls_back_to_backup() {
        when(search.isConfigured()).thenReturn(true);
        when(search.search(anyString())).thenThrow(new ResourceAccessException("Connection refused"));

        NutritionLookupResult r = resolver.resolve("broccoli", "50", "g");

        assertThat(r.success()).isTrue();
        assertThat(r.source()).isEqualTo("estimated");
        assertThat(r.nutrition().calories()).isEqualTo(17.0);
    }

    @Test
    void cache_key_is_lowercased_name_plus_raw_quantity_and_unit() {
        assertThat(NutritionCache.keyOf("Rice", "200", "grams")).isEqualTo("rice_200_grams");
        assertThat(NutritionCache.keyOf("Rice", null, null)).isEqualTo("rice_null_null");
    }

    @Test
    void gram_units() {
        assertThat(NutritionResolver.isGrams("g")).isTrue();
        assertThat(NutritionResolver.isGrams("Grams")).isTrue();
        assertThat(NutritionResolver.isGrams("gram")).isTrue();
        assertThat(NutritionResolver.isGrams("kg")).isFalse();
        assertThat(NutritionResolver.isGrams(null)).isFalse();
    }
}
