package com.herzen.rec.recommendation;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationSource;
import com.herzen.rec.recommendation.RecommendationModels.ScoredItem;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.*;

/**
 * Popularity ranking used when nothing personalized is available.
 * Score is {@code mean * ln(count + 1)}; unrated items fill any shortfall at the configured default score.
 */
@Component
public class PopularityFallback {
    private final RecommenderProperties properties;

    public PopularityFallback(RecommenderProperties properties) {
        this.properties = properties;
    }

    public RecommendationResult recommend(int limit, List<Rating> ratings, List<Item> items) {
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        if (items == null || items.isEmpty()) {
            return RecommendationResult.empty(RecommendationSource.POPULARITY);
        }

        Map<String, List<Double>> byItem = new LinkedHashMap<>();
        for (Rating rating : ratings) {
            byItem.computeIfAbsent(rating.itemId(), k -> new ArrayList<>()).add(rating.score());
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        byItem.forEach((itemId, values) -> scores.put(itemId, Rankings.mean(values) * Math.log(values.size() + 1)));
        List<ScoredItem> ranked = new ArrayList<>(Rankings.top(scores, limit));

        Set<String> seen = new HashSet<>(byItem.keySet());
        for (Item item : items) {
            if (ranked.size() >= limit) break;
            if (seen.add(item.id())) {
                ranked.add(new ScoredItem(item.id(), properties.getFallbackScore()));
            }
        }
        return new RecommendationResult(Rankings.sortedDescending(ranked), RecommendationSource.POPULARITY);
    }
}
