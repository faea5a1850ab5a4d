package com.mealvision.backend.mealphoto.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Entity
@Table(name = "meal_items", indexes = {
        @Index(name = "idx_meal_items_name", columnList = "name")
})
public class MealItemEntity {

    public static final int NAME_MAX_LENGTH = 255;
    public static final int UNIT_MAX_LENGTH = 20;
    /** amount / calories 是 DECIMAL(7,2)，三大營養素是 DECIMAL(6,2) */
    public static final int AMOUNT_PRECISION = 7;
    public static final int MACRO_PRECISION = 6;
    public static final int SCALE = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "meal_id", nullable = false)
    private MealEntity meal;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(precision = AMOUNT_PRECISION, scale = SCALE)
    private BigDecimal amount;

    /** g / ml / cup / piece ... 模型回什麼就存什麼 */
    @Column(length = UNIT_MAX_LENGTH)
    private String unit;

    @Column(precision = AMOUNT_PRECISION, scale = SCALE)
    private BigDecimal calories;

    @Column(precision = MACRO_PRECISION, scale = SCALE)
    private BigDecimal protein;

    @Column(precision = MACRO_PRECISION, scale = SCALE)
    private BigDecimal carbs;

    @Column(precision = MACRO_PRECISION, scale = SCALE)
    private BigDecimal fat;
}
