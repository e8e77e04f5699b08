package com.herzen.rec.snapshot;

import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.snapshot.SnapshotModels.CatalogHealth;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import com.herzen.rec.snapshot.SnapshotModels.CatalogStats;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
public class CatalogStatsService {

    public CatalogStats stats(CatalogSnapshot snapshot) {
        Map<Double, Long> distribution = snapshot.ratings().stream()
                .collect(Collectors.groupingBy(Rating::score, TreeMap::new, Collectors.counting()));
        long uniqueUsers = snapshot.ratings().stream().map(Rating::userId).distinct().count();
        double average = snapshot.ratings().stream().mapToDouble(Rating::score).average().orElse(0.0);
        return new CatalogStats(snapshot.ratings().size(), snapshot.items().size(), uniqueUsers, distribution, average);
    }

    public CatalogHealth health(CatalogSnapshot snapshot) {
        return new CatalogHealth("healthy", Instant.now(), snapshot.version(),
                snapshot.ratings().size(), snapshot.items().size(), snapshot.loadedAt(), snapshot.origin());
    }
}
