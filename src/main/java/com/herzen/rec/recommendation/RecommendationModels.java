package com.herzen.rec.recommendation;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class RecommendationModels {
    public record ScoredItem(String itemId, double score) {}

    public record RecommendationResult(List<ScoredItem> items, RecommendationSource source) {
        public RecommendationResult {
            items = List.copyOf(items);
        }

        public static RecommendationResult empty(RecommendationSource source) {
            return new RecommendationResult(List.of(), source);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public int size() {
            return items.size();
        }

        public List<String> itemIds() {
            return items.stream().map(ScoredItem::itemId).toList();
        }
    }

    public enum RecommendationSource { COLLABORATIVE, CONTENT, BLENDED, POPULARITY, NONE }

    public enum RecommendationMode {
        COLLABORATIVE, CONTENT, HYBRID;

        public static RecommendationMode fromParam(String value) {
            if (value == null || value.isBlank()) return HYBRID;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported recommendation type: " + value
                        + " (expected collaborative, content or hybrid)", e);
            }
        }

        public String param() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record RecommendationRequest(String userId, Integer limit, String type) {}

    public record RecommendationResponse(List<ScoredItem> recommendations,
                                         String userId,
                                         String algorithm,
                                         RecommendationSource source,
                                         long snapshotVersion,
                                         Instant generatedAt) {}
}
