package com.mealvision.backend.mealphoto.nutrition.search;

import java.util.List;

/**
 * 外部文字搜尋：query + 網域白名單 → 依排名排序的 {url, content}。
 * 傳輸錯誤直接丟出（RestClientException），由呼叫端決定要不要改走備援。
 */
public interface NutritionSearchClient {

    /** enabled 且有 key 才算可用 */
    boolean isConfigured();

    List<SearchHit> search(String query);
}
