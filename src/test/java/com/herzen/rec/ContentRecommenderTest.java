package com.herzen.rec;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.matrix.MatrixBuilder;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.recommendation.ContentRecommender;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationResult;
import com.herzen.rec.recommendation.RecommendationModels.RecommendationSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentRecommenderTest {
    private static final List<Item> ITEMS = List.of(
            new Item("m1", "Galaxy Raiders", "Space pirates battle robots across the galaxy", "Sci-Fi", "2021-01-01"),
            new Item("m2", "Galaxy Raiders", "Space pirates battle robots across the galaxy", "Sci-Fi", "2022-03-01"),
            new Item("m3", "Robot Uprising", "Robots rebel against their makers in space", "Sci-Fi", "2020-07-01"),
            new Item("m4", "Wedding Bells", "A romantic comedy about a chaotic wedding", "Romance", "2019-02-01"));

    private final RecommenderProperties properties = new RecommenderProperties();
    private final ContentRecommender recommender = new ContentRecommender(properties);
    private final ContentSimilarityMatrix matrix = new MatrixBuilder(properties).buildContentFeatures(ITEMS);

    @Test
    void recommendsSimilarItemsAndExcludesLikedOrRatedOnes() {
        RecommendationResult result = recommender.recommend("u1", 10, matrix, List.of(
                new Rating("u1", "m1", 5),
                new Rating("u1", "m4", 2)));

        assertEquals(RecommendationSource.CONTENT, result.source());
        assertEquals("m2", result.itemIds().get(0));
        assertEquals(1.0, result.items().get(0).score(), 1e-9);
        assertFalse(result.itemIds().contains("m1"));
        assertFalse(result.itemIds().contains("m4"));
        assertEquals(List.of("m2", "m3"), result.itemIds());
    }

    @Test
    void userWithoutLikedItemsGetsNothing() {
        List<Rating> ratings = List.of(new Rating("u1", "m1", 3), new Rating("u1", "m2", 1));

        assertTrue(recommender.recommend("u1", 10, matrix, ratings).isEmpty());
        assertTrue(recommender.recommend("stranger", 10, matrix, ratings).isEmpty());
    }

    @Test
    void candidateScoreIsMeanOverLikedItems() {
        RecommendationResult result = recommender.recommend("u1", 10, matrix, List.of(
                new Rating("u1", "m1", 5),
                new Rating("u1", "m4", 4)));

        double expected = (matrix.similarity("m1", "m2") + matrix.similarity("m4", "m2")) / 2;
        double m2 = result.items().stream().filter(i -> i.itemId().equals("m2")).findFirst().orElseThrow().score();
        assertEquals(expected, m2, 1e-9);
    }

    @Test
    void likedItemsMissingFromCatalogAreSkipped() {
        assertTrue(recommender.recommend("u1", 10, matrix, List.of(new Rating("u1", "ghost", 5))).isEmpty());

        RecommendationResult result = recommender.recommend("u1", 10, matrix, List.of(
                new Rating("u1", "ghost", 5),
                new Rating("u1", "m3", 5)));
        assertEquals(3, result.size());
        assertFalse(result.itemIds().contains("ghost"));
    }

    @Test
    void respectsLimitAndEmptyMatrix() {
        List<Rating> ratings = List.of(new Rating("u1", "m1", 5));

        assertEquals(1, recommender.recommend("u1", 1, matrix, ratings).size());
        assertTrue(recommender.recommend("u1", 5, ContentSimilarityMatrix.EMPTY, ratings).isEmpty());
    }
}
