package com.herzen.rec.matrix;

import java.util.List;
import java.util.Map;

public class MatrixModels {
    public record UserItemMatrix(List<String> userIds,
                                 List<String> itemIds,
                                 Map<String, Map<String, Double>> scores) {
        public static final UserItemMatrix EMPTY = new UserItemMatrix(List.of(), List.of(), Map.of());

        public boolean isEmpty() {
            return userIds.isEmpty();
        }

        public boolean containsUser(String userId) {
            return scores.containsKey(userId);
        }

        public double score(String userId, String itemId) {
            return scores.getOrDefault(userId, Map.of()).getOrDefault(itemId, 0.0);
        }

        public double[] vector(String userId) {
            Map<String, Double> row = scores.getOrDefault(userId, Map.of());
            double[] vector = new double[itemIds.size()];
            for (int i = 0; i < itemIds.size(); i++) {
                vector[i] = row.getOrDefault(itemIds.get(i), 0.0);
            }
            return vector;
        }
    }

    public record ContentSimilarityMatrix(List<String> itemIds,
                                          Map<String, Integer> index,
                                          double[][] similarities) {
        public static final ContentSimilarityMatrix EMPTY = new ContentSimilarityMatrix(List.of(), Map.of(), new double[0][0]);

        public boolean isEmpty() {
            return itemIds.isEmpty();
        }

        public Integer indexOf(String itemId) {
            return index.get(itemId);
        }

        public double similarity(int row, int column) {
            return similarities[row][column];
        }

        public double similarity(String a, String b) {
            Integer row = index.get(a);
            Integer column = index.get(b);
            if (row == null || column == null) return 0.0;
            return similarities[row][column];
        }
    }

    public record TfidfFeatures(List<String> vocabulary, double[][] vectors) {}
}
