package com.herzen.rec.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable constants of the recommendation engine and its catalog feed.
 */
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {

    /**
     * Number of most similar users consulted by collaborative filtering.
     */
    private int neighborCount = 10;

    /**
     * Weight applied to collaborative scores in the hybrid blend.
     */
    private double collaborativeWeight = 0.7;

    /**
     * Weight applied to content-based scores in the hybrid blend.
     */
    private double contentWeight = 0.3;

    /**
     * Popularity score given to items nobody has rated yet.
     */
    private double fallbackScore = 2.5;

    /**
     * Ratings a user needs before the hybrid path blends in collaborative filtering.
     */
    private int minRatingsForCollaborative = 5;

    /**
     * Lowest score that counts as "liked" for content-based seeding.
     */
    private double likedThreshold = 4.0;

    /**
     * Vocabulary cap of the TF-IDF item features.
     */
    private int maxFeatures = 1000;

    /**
     * Snapshot versions kept in each matrix cache.
     */
    private int matrixCacheSize = 4;

    private int defaultLimit = 10;

    private int maxLimit = 50;

    private Upstream upstream = new Upstream();

    private Refresh refresh = new Refresh();

    public int getNeighborCount() {
        return neighborCount;
    }

    public void setNeighborCount(int neighborCount) {
        this.neighborCount = neighborCount;
    }

    public double getCollaborativeWeight() {
        return collaborativeWeight;
    }

    public void setCollaborativeWeight(double collaborativeWeight) {
        this.collaborativeWeight = collaborativeWeight;
    }

    public double getContentWeight() {
        return contentWeight;
    }

    public void setContentWeight(double contentWeight) {
        this.contentWeight = contentWeight;
    }

    public double getFallbackScore() {
        return fallbackScore;
    }

    public void setFallbackScore(double fallbackScore) {
        this.fallbackScore = fallbackScore;
    }

    public int getMinRatingsForCollaborative() {
        return minRatingsForCollaborative;
    }

    public void setMinRatingsForCollaborative(int minRatingsForCollaborative) {
        this.minRatingsForCollaborative = minRatingsForCollaborative;
    }

    public double getLikedThreshold() {
        return likedThreshold;
    }

    public void setLikedThreshold(double likedThreshold) {
        this.likedThreshold = likedThreshold;
    }

    public int getMaxFeatures() {
        return maxFeatures;
    }

    public void setMaxFeatures(int maxFeatures) {
        this.maxFeatures = maxFeatures;
    }

    public int getMatrixCacheSize() {
        return matrixCacheSize;
    }

    public void setMatrixCacheSize(int matrixCacheSize) {
        this.matrixCacheSize = matrixCacheSize;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public void setRefresh(Refresh refresh) {
        this.refresh = refresh;
    }

    public static class Upstream {
        /**
         * Base URL of the catalog backend serving ratings and movies.
         */
        private String baseUrl = "http://localhost:3001";

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(10);

        /**
         * Publish generated mock data when the backend cannot be read.
         * When disabled the previous snapshot stays in place.
         */
        private boolean mockFallback = true;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public boolean isMockFallback() {
            return mockFallback;
        }

        public void setMockFallback(boolean mockFallback) {
            this.mockFallback = mockFallback;
        }
    }

    public static class Refresh {
        private boolean enabled = true;

        /**
         * Delay between catalog refreshes; the first refresh runs at startup.
         */
        private long fixedDelayMs = 300_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }
    }
}
