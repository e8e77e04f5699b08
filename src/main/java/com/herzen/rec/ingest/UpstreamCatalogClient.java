package com.herzen.rec.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.ingest.IngestModels.BackendStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads ratings and movies from the catalog backend and normalizes them into domain records.
 */
@Component
public class UpstreamCatalogClient {
    private static final Logger logger = LoggerFactory.getLogger(UpstreamCatalogClient.class);

    static final String RATINGS_PATH = "/ratings/all";
    static final String RATINGS_STATS_PATH = "/ratings/stats";
    static final String MOVIES_PATH = "/movies";
    private static final String UNKNOWN_CATEGORY = "Unknown";

    private final RestClient restClient;
    private final String baseUrl;

    public UpstreamCatalogClient(RestClient upstreamRestClient, RecommenderProperties properties) {
        this.restClient = upstreamRestClient;
        this.baseUrl = properties.getUpstream().getBaseUrl();
    }

    public List<Rating> fetchRatings() {
        JsonNode body = getArray(RATINGS_PATH);
        List<Rating> ratings = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : body) {
            String userId = text(node, "userId");
            String itemId = text(node, "movieId");
            JsonNode score = node.get("score");
            if (userId == null || itemId == null || score == null || !score.isNumber()
                    || score.asDouble() < 1 || score.asDouble() > 5) {
                skipped++;
                continue;
            }
            ratings.add(new Rating(userId, itemId, score.asDouble()));
        }
        if (skipped > 0) {
            logger.warn("Skipped {} malformed ratings from {}", skipped, RATINGS_PATH);
        }
        logger.info("Loaded {} ratings from backend", ratings.size());
        return ratings;
    }

    public List<Item> fetchItems() {
        JsonNode body = getArray(MOVIES_PATH);
        List<Item> items = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : body) {
            String id = text(node, "_id");
            if (id == null) id = text(node, "id");
            if (id == null) {
                skipped++;
                continue;
            }
            items.add(new Item(id,
                    textOrEmpty(node, "title"),
                    textOrEmpty(node, "description"),
                    category(node.get("category")),
                    textOrEmpty(node, "releaseDate")));
        }
        if (skipped > 0) {
            logger.warn("Skipped {} movies without an id from {}", skipped, MOVIES_PATH);
        }
        logger.info("Loaded {} movies from backend", items.size());
        return items;
    }

    public BackendStatus checkConnectivity() {
        try {
            boolean ratingsOk = probe(RATINGS_STATS_PATH);
            boolean moviesOk = probe(MOVIES_PATH);
            return new BackendStatus(baseUrl, ratingsOk, moviesOk, ratingsOk && moviesOk, null);
        } catch (RestClientException e) {
            logger.error("Backend connection test failed: {}", e.getMessage());
            return new BackendStatus(baseUrl, false, false, false, e.getMessage());
        }
    }

    private boolean probe(String path) {
        try {
            return restClient.get().uri(path).retrieve().toBodilessEntity().getStatusCode().is2xxSuccessful();
        } catch (RestClientResponseException e) {
            logger.debug("Probe {} answered {}", path, e.getStatusCode());
            return false;
        }
    }

    private JsonNode getArray(String path) {
        JsonNode body;
        try {
            body = restClient.get().uri(path).retrieve().body(JsonNode.class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException(path, e.getMessage(), e);
        }
        if (body == null || !body.isArray()) {
            throw new CatalogUnavailableException(path, "expected a JSON array", null);
        }
        return body;
    }

    private String category(JsonNode node) {
        if (node == null || node.isNull()) return UNKNOWN_CATEGORY;
        if (node.isObject()) {
            String name = text(node, "name");
            return name == null ? UNKNOWN_CATEGORY : name;
        }
        if (node.isTextual()) return node.asText();
        return UNKNOWN_CATEGORY;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private String textOrEmpty(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? "" : value;
    }
}
