package com.herzen.rec.recommendation;

import com.herzen.rec.recommendation.RecommendationModels.ScoredItem;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

final class Rankings {
    private static final Comparator<ScoredItem> BY_SCORE_DESC = Comparator.comparingDouble(ScoredItem::score).reversed();

    private Rankings() {}

    /**
     * Highest scores first; equal scores keep the map's encounter order.
     */
    static List<ScoredItem> top(Map<String, Double> scores, int limit) {
        return scores.entrySet().stream()
                .filter(e -> Double.isFinite(e.getValue()))
                .map(e -> new ScoredItem(e.getKey(), e.getValue()))
                .sorted(BY_SCORE_DESC)
                .limit(Math.max(limit, 0))
                .toList();
    }

    static List<ScoredItem> sortedDescending(List<ScoredItem> items) {
        return items.stream().sorted(BY_SCORE_DESC).toList();
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
