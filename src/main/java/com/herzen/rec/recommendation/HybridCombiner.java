package com.herzen.rec.recommendation;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.matrix.MatrixCache;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationSource;
import com.herzen.rec.recommendation.RecommendationModels.ScoredItem;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the personalized path by how many ratings the user has:
 * at least {@code minRatingsForCollaborative} blends collaborative and content scores,
 * fewer (but some) uses content only, none skips personalization.
 * An empty personalized result falls back to popularity.
 */
@Component
public class HybridCombiner {
    private static final Logger logger = LoggerFactory.getLogger(HybridCombiner.class);

    private final CollaborativeRecommender collaborative;
    private final ContentRecommender content;
    private final PopularityFallback popularity;
    private final MatrixCache matrixCache;
    private final RecommenderProperties properties;

    public HybridCombiner(CollaborativeRecommender collaborative,
                          ContentRecommender content,
                          PopularityFallback popularity,
                          MatrixCache matrixCache,
                          RecommenderProperties properties) {
        this.collaborative = collaborative;
        this.content = content;
        this.popularity = popularity;
        this.matrixCache = matrixCache;
        this.properties = properties;
    }

    public RecommendationResult recommend(String userId, int limit, CatalogSnapshot snapshot) {
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        List<Rating> ratings = snapshot.ratings();
        long ratingCount = ratings.stream().filter(r -> r.userId().equals(userId)).count();

        RecommendationResult personalized;
        if (ratingCount >= properties.getMinRatingsForCollaborative()) {
            personalized = blend(userId, limit, snapshot);
        } else if (ratingCount > 0) {
            personalized = content.recommend(userId, limit, matrixCache.contentMatrix(snapshot), ratings);
        } else {
            personalized = RecommendationResult.empty(RecommendationSource.NONE);
        }

        if (!personalized.isEmpty()) {
            logger.debug("Hybrid path {} for user {} ({} ratings): {} items", personalized.source(), userId, ratingCount, personalized.size());
            return personalized;
        }
        logger.info("No personalized recommendations for user {}, using popularity fallback", userId);
        return popularity.recommend(limit, ratings, snapshot.items());
    }

    private RecommendationResult blend(String userId, int limit, CatalogSnapshot snapshot) {
        RecommendationResult cf = collaborative.recommend(userId, limit, matrixCache.userItemMatrix(snapshot));
        int contentLimit = limit / 2;
        RecommendationResult cb = contentLimit >= 1
                ? content.recommend(userId, contentLimit, matrixCache.contentMatrix(snapshot), snapshot.ratings())
                : RecommendationResult.empty(RecommendationSource.CONTENT);

        Map<String, Double> combined = new LinkedHashMap<>();
        for (ScoredItem item : cf.items()) {
            combined.put(item.itemId(), item.score() * properties.getCollaborativeWeight());
        }
        for (ScoredItem item : cb.items()) {
            combined.merge(item.itemId(), item.score() * properties.getContentWeight(), Double::sum);
        }
        return new RecommendationResult(Rankings.top(combined, limit), RecommendationSource.BLENDED);
    }
}
