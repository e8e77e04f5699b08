package com.herzen.rec.recommendation;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.matrix.MatrixModels.UserItemMatrix;
import com.herzen.rec.matrix.Vectors;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationSource;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.*;

/**
 * User-based collaborative filtering over the user-item matrix.
 * An item's score is the plain mean of {@code neighborRating * neighborSimilarity}
 * over the neighbours that rated it.
 */
@Component
public class CollaborativeRecommender {
    private final RecommenderProperties properties;

    public CollaborativeRecommender(RecommenderProperties properties) {
        this.properties = properties;
    }

    public RecommendationResult recommend(String userId, int limit, UserItemMatrix matrix) {
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        if (matrix == null || matrix.isEmpty() || !matrix.containsUser(userId)) {
            return RecommendationResult.empty(RecommendationSource.COLLABORATIVE);
        }

        double[] target = matrix.vector(userId);
        List<Neighbor> neighbors = matrix.userIds().stream()
                .filter(other -> !other.equals(userId))
                .map(other -> new Neighbor(other, Vectors.cosine(target, matrix.vector(other))))
                .sorted(Comparator.comparingDouble(Neighbor::similarity).reversed())
                .limit(properties.getNeighborCount())
                .toList();

        Map<String, List<Double>> contributions = new LinkedHashMap<>();
        for (Neighbor neighbor : neighbors) {
            for (String itemId : matrix.itemIds()) {
                double rating = matrix.score(neighbor.userId(), itemId);
                if (rating > 0 && matrix.score(userId, itemId) <= 0) {
                    contributions.computeIfAbsent(itemId, k -> new ArrayList<>()).add(rating * neighbor.similarity());
                }
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        contributions.forEach((itemId, values) -> scores.put(itemId, Rankings.mean(values)));
        return new RecommendationResult(Rankings.top(scores, limit), RecommendationSource.COLLABORATIVE);
    }

    private record Neighbor(String userId, double similarity) {}
}
