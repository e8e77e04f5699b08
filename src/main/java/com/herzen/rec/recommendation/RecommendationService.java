package com.herzen.rec.recommendation;

import com.herzen.rec.matrix.MatrixCache;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationMode;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import com.herzen.rec.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

@Service
public class RecommendationService {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationService.class);

    private final SnapshotStore snapshotStore;
    private final MatrixCache matrixCache;
    private final CollaborativeRecommender collaborative;
    private final ContentRecommender content;
    private final PopularityFallback popularity;
    private final HybridCombiner hybrid;

    public RecommendationService(SnapshotStore snapshotStore,
                                 MatrixCache matrixCache,
                                 CollaborativeRecommender collaborative,
                                 ContentRecommender content,
                                 PopularityFallback popularity,
                                 HybridCombiner hybrid) {
        this.snapshotStore = snapshotStore;
        this.matrixCache = matrixCache;
        this.collaborative = collaborative;
        this.content = content;
        this.popularity = popularity;
        this.hybrid = hybrid;
    }

    public RecommendationResult computeRecommendations(String userId, int limit, RecommendationMode mode) {
        return computeRecommendations(userId, limit, mode, snapshotStore.current());
    }

    public RecommendationResult computeRecommendations(String userId, int limit, RecommendationMode mode, CatalogSnapshot snapshot) {
        Assert.hasText(userId, "userId must not be blank");
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        Assert.notNull(mode, "mode must not be null");

        RecommendationResult result = switch (mode) {
            case COLLABORATIVE -> collaborative.recommend(userId, limit, matrixCache.userItemMatrix(snapshot));
            case CONTENT -> content.recommend(userId, limit, matrixCache.contentMatrix(snapshot), snapshot.ratings());
            case HYBRID -> hybrid.recommend(userId, limit, snapshot);
        };
        logger.debug("{} recommendations for user {} on snapshot v{}: {} items via {}",
                mode.param(), userId, snapshot.version(), result.size(), result.source());
        return result;
    }

    public RecommendationResult computePopularity(int limit) {
        return computePopularity(limit, snapshotStore.current());
    }

    public RecommendationResult computePopularity(int limit, CatalogSnapshot snapshot) {
        Assert.isTrue(limit >= 1, "limit must be at least 1");
        return popularity.recommend(limit, snapshot.ratings(), snapshot.items());
    }
}
