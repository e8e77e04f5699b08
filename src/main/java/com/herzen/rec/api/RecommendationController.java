package com.herzen.rec.api;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationMode;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationRequest;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResponse;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationService;
import com.herzen.rec.snapshot.SnapshotModels.CatalogSnapshot;
import com.herzen.rec.snapshot.SnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private static final String POPULARITY = "popularity";

    private final RecommendationService recommendationService;
    private final SnapshotStore snapshotStore;
    private final RecommenderProperties properties;

    public RecommendationController(RecommendationService recommendationService,
                                    SnapshotStore snapshotStore,
                                    RecommenderProperties properties) {
        this.recommendationService = recommendationService;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestParam String userId,
                                                            @RequestParam(required = false) Integer limit,
                                                            @RequestParam(required = false, defaultValue = "hybrid") String type) {
        return ResponseEntity.ok(respond(userId, limit, type));
    }

    @PostMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestBody RecommendationRequest request) {
        return ResponseEntity.ok(respond(request.userId(), request.limit(), request.type()));
    }

    @GetMapping("/popular")
    public ResponseEntity<RecommendationResponse> popular(@RequestParam(required = false) Integer limit) {
        CatalogSnapshot snapshot = snapshotStore.current();
        RecommendationResult result = recommendationService.computePopularity(checkLimit(limit), snapshot);
        return ResponseEntity.ok(new RecommendationResponse(result.items(), null, POPULARITY, result.source(),
                snapshot.version(), Instant.now()));
    }

    private RecommendationResponse respond(String userId, Integer limit, String type) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        RecommendationMode mode = RecommendationMode.fromParam(type);
        CatalogSnapshot snapshot = snapshotStore.current();
        RecommendationResult result = recommendationService.computeRecommendations(userId, checkLimit(limit), mode, snapshot);
        return new RecommendationResponse(result.items(), userId, mode.param(), result.source(),
                snapshot.version(), Instant.now());
    }

    private int checkLimit(Integer limit) {
        int value = limit == null ? properties.getDefaultLimit() : limit;
        if (value < 1 || value > properties.getMaxLimit()) {
            throw new IllegalArgumentException("limit must be between 1 and " + properties.getMaxLimit());
        }
        return value;
    }
}
