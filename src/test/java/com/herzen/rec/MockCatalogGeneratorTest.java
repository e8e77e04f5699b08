package com.herzen.rec;

import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.ingest.MockCatalogGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MockCatalogGeneratorTest {
    private final MockCatalogGenerator generator = new MockCatalogGenerator();

    @Test
    void generatesSameCatalogEveryTime() {
        assertEquals(generator.ratings(), new MockCatalogGenerator().ratings());
        assertEquals(generator.items(), new MockCatalogGenerator().items());
    }

    @Test
    void everyUserRatesBetweenTenAndThirtyDistinctMovies() {
        Map<String, List<Rating>> byUser = generator.ratings().stream()
                .collect(Collectors.groupingBy(Rating::userId));

        assertEquals(20, byUser.size());
        byUser.forEach((user, ratings) -> {
            assertTrue(ratings.size() >= 10 && ratings.size() <= 30, user + " rated " + ratings.size());
            assertEquals(ratings.size(), ratings.stream().map(Rating::itemId).distinct().count());
        });
        assertTrue(generator.ratings().stream().allMatch(r -> r.score() >= 1 && r.score() <= 5
                && r.score() == Math.rint(r.score())));
    }

    @Test
    void itemsCoverEveryRatedMovie() {
        List<Item> items = generator.items();
        Set<String> ids = items.stream().map(Item::id).collect(Collectors.toSet());

        assertEquals(50, items.size());
        assertEquals("movie_1", items.get(0).id());
        assertTrue(generator.ratings().stream().allMatch(r -> ids.contains(r.itemId())));
        assertTrue(items.stream().allMatch(i -> i.description().contains(i.category().toLowerCase())));
    }
}
