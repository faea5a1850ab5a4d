package com.mealvision.backend.mealphoto.pipeline;

import com.mealvision.backend.mealphoto.model.ConfidenceTier;
import com.mealvision.backend.mealphoto.model.MealPhotoRequest;
import com.mealvision.backend.mealphoto.model.NutritionEntry;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mealvision.backend.mealphoto.pipeline.PipelineStep.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineTransitionsTest {

    private static final RecognizedItem RICE = new RecognizedItem("rice", "200", "grams", null, ConfidenceTier.HIGH);

    private static PipelineState fresh() {
        return PipelineState.initial(1L, new MealPhotoRequest(10L, "p.jpg", null));
    }

    @Test
    void analyze_with_items_goes_to_search() {
        PipelineState s = fresh().toBuilder().recognizedItems(List.of(RICE)).build();
        assertThat(PipelineTransitions.next(ANALYZE_PHOTO, s)).isEqualTo(SEARCH_NUTRITION);
    }

    @Test
    void analyze_with_items_and_existing_nutrition_skips_search() {
        PipelineState s = fresh().toBuilder()
                .recognizedItems(List.of(RICE))
                .nutritionData(List.of(NutritionEntry.placeholder(RICE)))
                .build();
        assertThat(PipelineTransitions.next(ANALYZE_PHOTO, s)).isEqualTo(CALCULATE_TOTALS);
    }

    @Test
    void analyze_with_error_goes_to_error_even_if_items_exist() {
        PipelineState s = fresh().toBuilder().recognizedItems(List.of(RICE)).error("boom").build();
        assertThat(PipelineTransitions.next(ANALYZE_PHOTO, s)).isEqualTo(HANDLE_ERROR);
    }

    @Test
    void analyze_with_zero_items_goes_to_error() {
        assertThat(PipelineTransitions.next(ANALYZE_PHOTO, fresh())).isEqualTo(HANDLE_ERROR);
        assertThat(PipelineTransitions.routingError(ANALYZE_PHOTO)).isEqualTo("No food items recognized in photo");
    }

    @Test
    void search_always_goes_to_calculate() {
        assertThat(PipelineTransitions.next(SEARCH_NUTRITION, fresh())).isEqualTo(CALCULATE_TOTALS);
        assertThat(PipelineTransitions.next(SEARCH_NUTRITION, fresh().toBuilder().error("x").build()))
                .isEqualTo(CALCULATE_TOTALS);
    }

    @Test
    void calculate_routes_on_totals() {
        PipelineState withTotals = fresh().toBuilder().totals(NutritionFacts.ZERO).build();
        assertThat(PipelineTransitions.next(CALCULATE_TOTALS, withTotals)).isEqualTo(CREATE_MEAL);

        assertThat(PipelineTransitions.next(CALCULATE_TOTALS, fresh())).isEqualTo(HANDLE_ERROR);
        assertThat(PipelineTransitions.routingError(CALCULATE_TOTALS)).isEqualTo("Failed to calculate nutrition totals");

        PipelineState errored = withTotals.toBuilder().error("late failure").build();
        assertThat(PipelineTransitions.next(CALCULATE_TOTALS, errored)).isEqualTo(HANDLE_ERROR);
    }

    @Test
    void terminal_steps_have_no_successor() {
        assertThat(CREATE_MEAL.isTerminal()).isTrue();
        assertThat(HANDLE_ERROR.isTerminal()).isTrue();
        assertThatThrownBy(() -> PipelineTransitions.next(CREATE_MEAL, fresh()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void initial_state_defaults_category_to_snack() {
        PipelineState s = fresh();
        assertThat(s.getCategory()).isEqualTo("snack");
        assertThat(s.getRecognizedItems()).isEmpty();
        assertThat(s.getConfidence()).isEqualTo(ConfidenceTier.LOW);
        assertThat(s.isSuccess()).isFalse();
    }
}
