package com.herzen.rec.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.matrix.MatrixModels.UserItemMatrix;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine caches holding derived matrices, keyed by snapshot version.
 * Only the newest few versions are worth keeping: requests always read the current snapshot.
 */
@Configuration
public class MatrixCacheConfig {

    @Bean
    public Cache<Long, UserItemMatrix> userItemMatrixCache(RecommenderProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getMatrixCacheSize())
                .recordStats()
                .build();
    }

    @Bean
    public Cache<Long, ContentSimilarityMatrix> contentMatrixCache(RecommenderProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getMatrixCacheSize())
                .recordStats()
                .build();
    }
}
