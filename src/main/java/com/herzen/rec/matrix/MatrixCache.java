package com.herzen.rec.matrix;

import com.github.benmanes.caffeine.cache.Cache;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.matrix.MatrixModels.UserItemMatrix;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derived matrices per snapshot version. Each matrix is built on first use and
 * shared by every request that reads the same version.
 */
@Component
public class MatrixCache {
    private static final Logger logger = LoggerFactory.getLogger(MatrixCache.class);

    private final MatrixBuilder builder;
    private final Cache<Long, UserItemMatrix> userItemMatrixCache;
    private final Cache<Long, ContentSimilarityMatrix> contentMatrixCache;

    public MatrixCache(MatrixBuilder builder,
                       Cache<Long, UserItemMatrix> userItemMatrixCache,
                       Cache<Long, ContentSimilarityMatrix> contentMatrixCache) {
        this.builder = builder;
        this.userItemMatrixCache = userItemMatrixCache;
        this.contentMatrixCache = contentMatrixCache;
    }

    public UserItemMatrix userItemMatrix(CatalogSnapshot snapshot) {
        return userItemMatrixCache.get(snapshot.version(), version -> {
            logger.info("Building user-item matrix for snapshot v{}", version);
            return builder.buildUserItemMatrix(snapshot.ratings());
        });
    }

    public ContentSimilarityMatrix contentMatrix(CatalogSnapshot snapshot) {
        return contentMatrixCache.get(snapshot.version(), version -> {
            logger.info("Building content similarity matrix for snapshot v{}", version);
            return builder.buildContentFeatures(snapshot.items());
        });
    }
}
