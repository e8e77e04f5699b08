package com.herzen.rec.snapshot;

import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import com.herzen.rec.snapshot.SnapshotModels.SnapshotOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the catalog snapshot every computation reads from.
 * Publishing swaps in a whole new snapshot; readers never observe a partial update.
 */
@Component
public class SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());
    private final AtomicLong versions = new AtomicLong();

    public CatalogSnapshot current() {
        return current.get();
    }

    public List<Rating> getCurrentRatings() {
        return current.get().ratings();
    }

    public List<Item> getCurrentItems() {
        return current.get().items();
    }

    public CatalogSnapshot publish(List<Rating> ratings, List<Item> items, SnapshotOrigin origin) {
        CatalogSnapshot snapshot = new CatalogSnapshot(versions.incrementAndGet(), ratings, items, Instant.now(), origin);
        current.set(snapshot);
        logger.info("Published catalog snapshot v{} ({}): {} ratings, {} items",
                snapshot.version(), origin, snapshot.ratings().size(), snapshot.items().size());
        return snapshot;
    }
}
