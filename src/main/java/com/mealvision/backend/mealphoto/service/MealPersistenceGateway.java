package com.mealvision.backend.mealphoto.service;

import com.mealvision.backend.mealphoto.entity.MealEntity;
import com.mealvision.backend.mealphoto.entity.MealItemEntity;
import com.mealvision.backend.mealphoto.model.NutritionEntry;
import com.mealvision.backend.mealphoto.model.NutritionFacts;
import com.mealvision.backend.mealphoto.model.PhotoProcessingStatus;
import com.mealvision.backend.mealphoto.model.RecognizedItem;
import com.mealvision.backend.mealphoto.pipeline.PipelineState;
import com.mealvision.backend.mealphoto.repo.MealRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * meals / meal_items 寫入。
 * 成功路徑：一個 transaction 寫父 + 子；子項目個別失敗只記 log 跳過，父寫入失敗整筆 rollback。
 * 補救路徑：只寫一筆 FAILED 的父紀錄，項目標 needs_review。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MealPersistenceGateway {

    static final String NOTES_COMPLETED = "Auto-generated from photo analysis";
    static final String NOTES_NEEDS_REVIEW = "Partial results - needs manual review";
    static final double DEFAULT_AMOUNT = 100.0;

    private final MealRepository mealRepo;
    private final ObjectMapper om;

    /** @return 新的 meal id；任何例外都往外丟，由 pipeline 轉成 Database error */
    @Transactional
    public Long saveCompleted(PipelineState s) {
        NutritionFacts t = s.getTotals();
        if (t == null) throw new IllegalStateException("TOTALS_MISSING");

        MealEntity meal = baseMeal(s);
        meal.setCalories(dec(t.calories()));
        meal.setProtein(dec(t.protein()));
        meal.setCarbs(dec(t.carbs()));
        meal.setFat(dec(t.fat()));
        meal.setFiber(dec(t.fiber()));
        meal.setSugar(dec(t.sugar()));
        meal.setSodium(dec(t.sodium()));
        meal.setPhotoProcessingStatus(PhotoProcessingStatus.COMPLETED);
        meal.setAiRecognizedItems(itemsJson(s.getRecognizedItems(), false));
        meal.setAiSummary(completedSummary(s.getRecognizedItems()));
        meal.setNotes(NOTES_COMPLETED);

        int skipped = 0;
        for (NutritionEntry e : s.getNutritionData()) {
            try {
                meal.addItem(toItem(e));
            } catch (RuntimeException ex) {
                skipped++;
                String name = (e == null || e.item() == null) ? null : e.item().name();
                log.warn("meal_item_skipped dayId={} name={} err={}", s.getDayId(), name, ex.toString());
            }
        }

        MealEntity saved = mealRepo.saveAndFlush(meal);
        log.info("meal_created mealId={} dayId={} items={} skipped={}",
                saved.getId(), s.getDayId(), saved.getItems().size(), skipped);
        return saved.getId();
    }

    /** 補救寫入；失敗照樣丟出，由呼叫端吞掉 */
    @Transactional
    public Long saveNeedsReview(PipelineState s) {
        List<RecognizedItem> items = s.getRecognizedItems();

        MealEntity meal = baseMeal(s);
        meal.setPhotoProcessingStatus(PhotoProcessingStatus.FAILED);
        meal.setPhotoProcessingError(s.getError());
        meal.setAiRecognizedItems(itemsJson(items, true));
        meal.setAiSummary("Partial recognition: " + items.size() + " items need review");
        meal.setNotes(NOTES_NEEDS_REVIEW);

        MealEntity saved = mealRepo.saveAndFlush(meal);
        log.info("meal_needs_review_saved mealId={} dayId={} items={}", saved.getId(), s.getDayId(), items.size());
        return saved.getId();
    }

    static String completedSummary(List<RecognizedItem> items) {
        String names = items.stream().map(RecognizedItem::name).collect(Collectors.joining(", "));
        return "Recognized " + items.size() + " items: " + names;
    }

    private static MealEntity baseMeal(PipelineState s) {
        MealEntity meal = new MealEntity();
        meal.setUserId(s.getUserId());
        meal.setDayId(s.getDayId());
        meal.setCategory(s.getCategory());
        meal.setPhotoPath(s.getPhotoPath());
        return meal;
    }

    /**
     * 子項目在掛上父紀錄前先對齊欄位限制：文字超長就截斷，數字超出 DECIMAL 範圍就丟例外（整個子項目跳過）。
     * 子列是跟父一起 flush 的，所以不能讓任何一列在 DB 端才失敗。
     */
    private static MealItemEntity toItem(NutritionEntry e) {
        RecognizedItem item = e.item();
        NutritionFacts n = e.nutrition() == null ? NutritionFacts.ZERO : e.nutrition();

        Double q = item.quantityAsNumberOrNull();
        MealItemEntity row = new MealItemEntity();
        row.setName(fitText(item.name(), MealItemEntity.NAME_MAX_LENGTH, "name"));
        row.setAmount(fitDecimal(q == null ? DEFAULT_AMOUNT : q, MealItemEntity.AMOUNT_PRECISION, "amount"));
        row.setUnit(fitText(item.unit(), MealItemEntity.UNIT_MAX_LENGTH, "unit"));
        row.setCalories(fitDecimal(n.calories(), MealItemEntity.AMOUNT_PRECISION, "calories"));
        row.setProtein(fitDecimal(n.protein(), MealItemEntity.MACRO_PRECISION, "protein"));
        row.setCarbs(fitDecimal(n.carbs(), MealItemEntity.MACRO_PRECISION, "carbs"));
        row.setFat(fitDecimal(n.fat(), MealItemEntity.MACRO_PRECISION, "fat"));
        return row;
    }

    static String fitText(String v, int maxLength, String field) {
        if (v == null || v.length() <= maxLength) return v;
        log.warn("meal_item_truncated field={} length={} max={}", field, v.length(), maxLength);
        return v.substring(0, maxLength);
    }

    /** scale 固定 2，整數位最多 precision - 2 位 */
    static BigDecimal fitDecimal(double v, int precision, String field) {
        BigDecimal d = dec(v);
        if (d.precision() - d.scale() > precision - MealItemEntity.SCALE) {
            throw new IllegalArgumentException("VALUE_OUT_OF_RANGE field=" + field + " value=" + d.toPlainString());
        }
        return d;
    }

    private ArrayNode itemsJson(List<RecognizedItem> items, boolean needsReview) {
        ArrayNode arr = om.createArrayNode();
        for (RecognizedItem it : items) {
            ObjectNode o = om.valueToTree(it);
            if (needsReview) o.put("needs_review", true);
            arr.add(o);
        }
        return arr;
    }

    /** 非有限數字會丟 NumberFormatException，該子項目會被跳過 */
    private static BigDecimal dec(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP);
    }
}
