package com.mealvision.backend.mealphoto.model;

public record MealPhotoRequest(Long dayId, String photoPath, String category) {

    public static final String DEFAULT_CATEGORY = "snack";

    public MealPhotoRequest {
        if (category == null || category.isBlank()) category = DEFAULT_CATEGORY;
    }
}
