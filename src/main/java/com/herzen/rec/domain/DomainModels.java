package com.herzen.rec.domain;

public class DomainModels {
    public record Rating(String userId, String itemId, double score) {}

    public record Item(String id, String title, String description, String category, String releaseDate) {
        public String featureText() {
            return nullToEmpty(title) + " " + nullToEmpty(description) + " " + nullToEmpty(category);
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
