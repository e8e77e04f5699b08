package com.herzen.rec.ingest;

import com.herzen.rec.domain.DomainModels.Item;
import com.herzen.rec.domain.DomainModels.Rating;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Deterministic stand-in catalog published when the backend cannot be reached.
 */
@Component
public class MockCatalogGenerator {
    private static final long SEED = 42L;
    private static final int USERS = 20;
    private static final int MOVIES = 50;
    private static final int MIN_RATINGS_PER_USER = 10;
    private static final int MAX_RATINGS_PER_USER = 30;
    private static final double[] SCORE_WEIGHTS = {0.1, 0.1, 0.2, 0.3, 0.3};
    private static final List<String> CATEGORIES = List.of("Action", "Comedy", "Drama", "Horror", "Sci-Fi", "Romance");

    public List<Rating> ratings() {
        Random random = new Random(SEED);
        List<String> movieIds = IntStream.rangeClosed(1, MOVIES).mapToObj(i -> "movie_" + i).toList();
        List<Rating> ratings = new ArrayList<>();
        for (int u = 1; u <= USERS; u++) {
            String userId = "user_" + u;
            int count = MIN_RATINGS_PER_USER + random.nextInt(MAX_RATINGS_PER_USER - MIN_RATINGS_PER_USER + 1);
            List<String> shuffled = new ArrayList<>(movieIds);
            Collections.shuffle(shuffled, random);
            for (String movieId : shuffled.subList(0, count)) {
                ratings.add(new Rating(userId, movieId, drawScore(random)));
            }
        }
        return ratings;
    }

    public List<Item> items() {
        Random random = new Random(SEED);
        List<Item> items = new ArrayList<>();
        for (int i = 1; i <= MOVIES; i++) {
            String category = CATEGORIES.get(random.nextInt(CATEGORIES.size()));
            String releaseDate = String.format(Locale.ROOT, "202%d-%02d-01", random.nextInt(4), 1 + random.nextInt(12));
            items.add(new Item("movie_" + i,
                    "Movie " + i,
                    "This is a " + category.toLowerCase(Locale.ROOT) + " movie with exciting plot and great characters.",
                    category,
                    releaseDate));
        }
        return items;
    }

    private double drawScore(Random random) {
        double draw = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < SCORE_WEIGHTS.length; i++) {
            cumulative += SCORE_WEIGHTS[i];
            if (draw < cumulative) return i + 1;
        }
        return SCORE_WEIGHTS.length;
    }
}
