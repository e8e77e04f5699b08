package com.herzen.rec;

import com.herzen.rec.config.RecommenderProperties;
import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.matrix.MatrixBuilder;
import com.herzen.rec.matrix.MatrixModels.ContentSimilarityMatrix;
import com.herzen.rec.matrix.MatrixModels.UserItemMatrix;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatrixBuilderTest {
    private final MatrixBuilder builder = new MatrixBuilder(new RecommenderProperties());

    @Test
    void userItemMatrixTreatsUnratedCellsAsZero() {
        UserItemMatrix matrix = builder.buildUserItemMatrix(List.of(
                new Rating("u2", "m3", 4),
                new Rating("u1", "m1", 5),
                new Rating("u1", "m2", 3),
                new Rating("u2", "m1", 5)));

        assertEquals(List.of("u1", "u2"), matrix.userIds());
        assertEquals(List.of("m1", "m2", "m3"), matrix.itemIds());
        assertEquals(5.0, matrix.score("u1", "m1"));
        assertEquals(0.0, matrix.score("u1", "m3"));
        assertArrayEquals(new double[]{5, 0, 4}, matrix.vector("u2"));
        assertTrue(matrix.containsUser("u2"));
        assertFalse(matrix.containsUser("u9"));
    }

    @Test
    void emptySnapshotsGiveEmptySentinels() {
        assertSame(UserItemMatrix.EMPTY, builder.buildUserItemMatrix(List.of()));
        assertSame(ContentSimilarityMatrix.EMPTY, builder.buildContentFeatures(List.of()));
        assertTrue(UserItemMatrix.EMPTY.isEmpty());
        assertTrue(ContentSimilarityMatrix.EMPTY.isEmpty());
    }

    @Test
    void identicalItemsAreFullySimilarAndMatrixIsSymmetric() {
        ContentSimilarityMatrix matrix = builder.buildContentFeatures(List.of(
                new Item("m1", "Galaxy Raiders", "Space pirates battle robots across the galaxy", "Sci-Fi", "2021-01-01"),
                new Item("m2", "Galaxy Raiders", "Space pirates battle robots across the galaxy", "Sci-Fi", "2022-01-01"),
                new Item("m3", "Wedding Bells", "A romantic comedy about a chaotic wedding", "Romance", "2020-05-01")));

        assertEquals(List.of("m1", "m2", "m3"), matrix.itemIds());
        assertEquals(1.0, matrix.similarity("m1", "m2"), 1e-9);
        assertEquals(1.0, matrix.similarity("m1", "m1"), 1e-9);
        assertTrue(matrix.similarity("m1", "m3") < 0.5);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals(matrix.similarity(i, j), matrix.similarity(j, i), 1e-12);
            }
        }
    }

    @Test
    void itemsWithoutUsableTextHaveZeroSimilarity() {
        ContentSimilarityMatrix matrix = builder.buildContentFeatures(List.of(
                new Item("a", "The", "a an the", "", ""),
                new Item("b", null, "", "", "")));

        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertEquals(0.0, matrix.similarity(i, j));
            }
        }
    }

    @Test
    void duplicateItemIdsResolveToFirstOccurrence() {
        ContentSimilarityMatrix matrix = builder.buildContentFeatures(List.of(
                new Item("m1", "Ocean Storm", "sailors fight a storm", "Drama", ""),
                new Item("m1", "Desert Heat", "nomads cross the dunes", "Adventure", "")));

        assertEquals(0, matrix.indexOf("m1"));
        assertNull(matrix.indexOf("m2"));
    }
}
