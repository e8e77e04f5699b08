package com.herzen.rec.snapshot;

import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class SnapshotModels {
    public enum SnapshotOrigin { EMPTY, UPSTREAM, MOCK }

    public record CatalogSnapshot(long version,
                                  List<Rating> ratings,
                                  List<Item> items,
                                  Instant loadedAt,
                                  SnapshotOrigin origin) {
        public CatalogSnapshot {
            ratings = List.copyOf(ratings);
            items = List.copyOf(items);
        }

        public static CatalogSnapshot empty() {
            return new CatalogSnapshot(0L, List.of(), List.of(), null, SnapshotOrigin.EMPTY);
        }

        public List<Rating> ratingsOf(String userId) {
            return ratings.stream().filter(r -> r.userId().equals(userId)).toList();
        }
    }

    public record CatalogStats(long totalRatings,
                               long totalItems,
                               long uniqueUsers,
                               Map<Double, Long> ratingDistribution,
                               double averageRating) {}

    public record CatalogHealth(String status,
                                Instant timestamp,
                                long snapshotVersion,
                                int ratingsCount,
                                int itemsCount,
                                Instant lastUpdate,
                                SnapshotOrigin origin) {}
}
