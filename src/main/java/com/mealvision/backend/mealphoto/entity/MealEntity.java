package com.mealvision.backend.mealphoto.entity;

import com.mealvision.backend.mealphoto.model.PhotoProcessingStatus;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "meals", indexes = {
        @Index(name = "idx_meals_day_id", columnList = "day_id"),
        @Index(name = "idx_meals_category", columnList = "category")
})
public class MealEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "day_id", nullable = false)
    private Long dayId;

    @Column(nullable = false, length = 20)
    private String category;

    // ===== 營養總和（補救紀錄不填）=====
    @Column(precision = 7, scale = 2)
    private BigDecimal calories;

    @Column(precision = 6, scale = 2)
    private BigDecimal protein;

    @Column(precision = 6, scale = 2)
    private BigDecimal carbs;

    @Column(precision = 6, scale = 2)
    private BigDecimal fat;

    @Column(precision = 5, scale = 2)
    private BigDecimal fiber;

    @Column(precision = 5, scale = 2)
    private BigDecimal sugar;

    /** mg */
    @Column(precision = 7, scale = 2)
    private BigDecimal sodium;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "photo_path", length = 500)
    private String photoPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "photo_processing_status", nullable = false, length = 20)
    private PhotoProcessingStatus photoProcessingStatus = PhotoProcessingStatus.PENDING;

    @Column(name = "photo_processing_error", columnDefinition = "TEXT")
    private String photoProcessingError;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ai_recognized_items", columnDefinition = "JSON")
    private JsonNode aiRecognizedItems;

    @Column(name = "ai_summary", columnDefinition = "TEXT")
    private String aiSummary;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @OneToMany(mappedBy = "meal", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<MealItemEntity> items = new ArrayList<>();

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }

    public void addItem(MealItemEntity item) {
        item.setMeal(this);
        items.add(item);
    }
}
