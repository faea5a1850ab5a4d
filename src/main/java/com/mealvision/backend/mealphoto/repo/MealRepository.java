package com.mealvision.backend.mealphoto.repo;

import com.mealvision.backend.mealphoto.entity.MealEntity;
import com.mealvision.backend.mealphoto.model.PhotoProcessingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MealRepository extends JpaRepository<MealEntity, Long> {

    List<MealEntity> findByDayIdAndPhotoProcessingStatus(Long dayId, PhotoProcessingStatus status);

    @Query("select m from MealEntity m left join fetch m.items where m.id = :id")
    Optional<MealEntity> findWithItemsById(@Param("id") Long id);
}
