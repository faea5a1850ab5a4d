package com.mealvision.backend.mealphoto.nutrition.search;

public record SearchHit(String url, String content) {

    public SearchHit {
        if (url == null) url = "";
        if (content == null) content = "";
    }
}
