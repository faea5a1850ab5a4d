package com.mealvision.backend.mealphoto.model;

public enum PhotoProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
