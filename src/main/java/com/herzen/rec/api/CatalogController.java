package com.herzen.rec.api;

import com.herzen.rec.ingest.CatalogRefreshService;
import com.herzen.rec.ingest.IngestModels.BackendStatusResponse;
import com.herzen.rec.ingest.UpstreamCatalogClient;
import com.herzen.rec.snapshot.CatalogStatsService;
import com.herzen.rec.snapshot.SnapshotModels.CatalogHealth;
import com.herzen.rec.snapshot.SnapshotModels.CatalogStats;
import com.herzen.rec.snapshot.SnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final SnapshotStore snapshotStore;
    private final CatalogStatsService statsService;
    private final CatalogRefreshService refreshService;
    private final UpstreamCatalogClient upstreamClient;

    public CatalogController(SnapshotStore snapshotStore,
                             CatalogStatsService statsService,
                             CatalogRefreshService refreshService,
                             UpstreamCatalogClient upstreamClient) {
        this.snapshotStore = snapshotStore;
        this.statsService = statsService;
        this.refreshService = refreshService;
        this.upstreamClient = upstreamClient;
    }

    @GetMapping("/health")
    public ResponseEntity<CatalogHealth> health() {
        return ResponseEntity.ok(statsService.health(snapshotStore.current()));
    }

    @GetMapping("/stats")
    public ResponseEntity<CatalogStats> stats() {
        return ResponseEntity.ok(statsService.stats(snapshotStore.current()));
    }

    @GetMapping("/backend-status")
    public ResponseEntity<BackendStatusResponse> backendStatus() {
        return ResponseEntity.ok(new BackendStatusResponse(Instant.now(), upstreamClient.checkConnectivity()));
    }

    @PostMapping("/refresh")
    public ResponseEntity<CatalogHealth> refresh() {
        return ResponseEntity.ok(statsService.health(refreshService.refresh()));
    }
}
