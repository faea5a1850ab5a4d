package com.mealvision.backend.mealphoto.model;

public enum Nutrient {
    CALORIES("calories"),
    PROTEIN("protein"),
    CARBS("carbs"),
    FAT("fat"),
    FIBER("fiber"),
    SUGAR("sugar"),
    SODIUM("sodium");

    private final String key;

    Nutrient(String key) {
        this.key = key;
    }

    public String key() { return key; }
}
