package com.herzen.rec.matrix;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.matrix.MatrixModels.TfidfFeatures;
import com.herzen.rec.matrix.MatrixModels.UserItemMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class MatrixBuilder {
    private static final Logger logger = LoggerFactory.getLogger(MatrixBuilder.class);

    private final RecommenderProperties properties;

    public MatrixBuilder(RecommenderProperties properties) {
        this.properties = properties;
    }

    public UserItemMatrix buildUserItemMatrix(List<Rating> ratings) {
        if (ratings == null || ratings.isEmpty()) return UserItemMatrix.EMPTY;

        Map<String, Map<String, Double>> rows = new TreeMap<>();
        SortedSet<String> itemIds = new TreeSet<>();
        for (Rating rating : ratings) {
            rows.computeIfAbsent(rating.userId(), u -> new HashMap<>()).put(rating.itemId(), rating.score());
            itemIds.add(rating.itemId());
        }

        Map<String, Map<String, Double>> frozen = new LinkedHashMap<>();
        rows.forEach((user, row) -> frozen.put(user, Map.copyOf(row)));
        logger.debug("Built user-item matrix: {} users x {} items", frozen.size(), itemIds.size());
        return new UserItemMatrix(List.copyOf(frozen.keySet()), List.copyOf(itemIds), Collections.unmodifiableMap(frozen));
    }

    public ContentSimilarityMatrix buildContentFeatures(List<Item> items) {
        if (items == null || items.isEmpty()) return ContentSimilarityMatrix.EMPTY;

        List<String> documents = items.stream().map(Item::featureText).toList();
        TfidfFeatures features = new TfidfVectorizer(properties.getMaxFeatures()).fitTransform(documents);

        int n = items.size();
        double[][] similarities = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double value = Vectors.cosine(features.vectors()[i], features.vectors()[j]);
                similarities[i][j] = value;
                similarities[j][i] = value;
            }
        }

        List<String> itemIds = items.stream().map(Item::id).toList();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < itemIds.size(); i++) {
            index.putIfAbsent(itemIds.get(i), i);
        }
        logger.debug("Built content similarity matrix: {} items, {} features", n, features.vocabulary().size());
        return new ContentSimilarityMatrix(itemIds, Map.copyOf(index), similarities);
    }
}
