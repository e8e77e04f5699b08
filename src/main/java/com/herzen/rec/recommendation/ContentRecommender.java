package com.herzen.rec.recommendation;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationSource;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ContentRecommender {
    private final RecommenderProperties properties;

    public ContentRecommender(RecommenderProperties properties) {
        this.properties = properties;
    }

    public RecommendationResult recommend(String userId, int limit, ContentSimilarityMatrix similarities, List<Rating> ratings) {
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        List<Rating> userRatings = ratings.stream().filter(r -> r.userId().equals(userId)).toList();
        if (userRatings.isEmpty() || similarities == null || similarities.isEmpty()) {
            return RecommendationResult.empty(RecommendationSource.CONTENT);
        }

        List<String> liked = userRatings.stream()
                .filter(r -> r.score() >= properties.getLikedThreshold())
                .map(Rating::itemId)
                .toList();
        if (liked.isEmpty()) {
            return RecommendationResult.empty(RecommendationSource.CONTENT);
        }

        Set<String> rated = userRatings.stream().map(Rating::itemId).collect(Collectors.toSet());
        List<String> itemIds = similarities.itemIds();
        Map<String, List<Double>> contributions = new LinkedHashMap<>();
        for (String likedItem : liked) {
            Integer row = similarities.indexOf(likedItem);
            if (row == null) continue;
            for (int column = 0; column < itemIds.size(); column++) {
                String candidate = itemIds.get(column);
                if (!candidate.equals(likedItem) && !rated.contains(candidate)) {
                    contributions.computeIfAbsent(candidate, k -> new ArrayList<>()).add(similarities.similarity(row, column));
                }
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        contributions.forEach((itemId, values) -> scores.put(itemId, Rankings.mean(values)));
        return new RecommendationResult(Rankings.top(scores, limit), RecommendationSource.CONTENT);
    }
}
