package com.herzen.rec.ingest;

import java.time.Instant;

public class IngestModels {
    public record BackendStatus(String backendUrl,
                                boolean ratingsEndpoint,
                                boolean moviesEndpoint,
                                boolean overallStatus,
                                String error) {}

    public record BackendStatusResponse(Instant timestamp, BackendStatus backendConnectivity) {}
}
