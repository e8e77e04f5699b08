package com.herzen.rec.ingest;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import com.herzen.rec.snapshot.SnapshotModels.SnapshotOrigin;
import com.herzen.rec.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

@Service
public class CatalogRefreshService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogRefreshService.class);

    private final UpstreamCatalogClient client;
    private final MockCatalogGenerator mockGenerator;
    private final SnapshotStore snapshotStore;
    private final RecommenderProperties properties;

    public CatalogRefreshService(UpstreamCatalogClient client,
                                 MockCatalogGenerator mockGenerator,
                                 SnapshotStore snapshotStore,
                                 RecommenderProperties properties) {
        this.client = client;
        this.mockGenerator = mockGenerator;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${recommender.refresh.fixed-delay-ms:300000}")
    public void scheduledRefresh() {
        if (!properties.getRefresh().isEnabled()) return;
        refresh();
    }

    /**
     * Loads both data sets and publishes them as one new snapshot.
     * Without mock fallback a failed load leaves the current snapshot in place.
     */
    public CatalogSnapshot refresh() {
        boolean mockFallback = properties.getUpstream().isMockFallback();
        try {
            Loaded<Rating> ratings = load(client::fetchRatings, mockGenerator::ratings, mockFallback);
            Loaded<Item> items = load(client::fetchItems, mockGenerator::items, mockFallback);
            SnapshotOrigin origin = ratings.mock() || items.mock() ? SnapshotOrigin.MOCK : SnapshotOrigin.UPSTREAM;
            return snapshotStore.publish(ratings.values(), items.values(), origin);
        } catch (CatalogUnavailableException e) {
            logger.error("Catalog refresh failed, keeping snapshot v{}: {}", snapshotStore.current().version(), e.getMessage());
            return snapshotStore.current();
        }
    }

    private <T> Loaded<T> load(Supplier<List<T>> upstream, Supplier<List<T>> mock, boolean mockFallback) {
        try {
            return new Loaded<>(upstream.get(), false);
        } catch (CatalogUnavailableException e) {
            if (!mockFallback) throw e;
            logger.warn("{}; using mock data", e.getMessage());
            return new Loaded<>(mock.get(), true);
        }
    }

    private record Loaded<T>(List<T> values, boolean mock) {}
}
