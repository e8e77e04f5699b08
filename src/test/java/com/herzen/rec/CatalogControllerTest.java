package com.herzen.rec;

import com.herzen.rec.domain.DomainModels.Rating;
import com.herzen.rec.snapshot.SnapshotModels.SnapshotOrigin;
import com.herzen.rec.snapshot.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CatalogControllerTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private SnapshotStore snapshotStore;

    @BeforeEach
    void publishCatalog() {
        snapshotStore.publish(List.of(
                new Rating("u1", "m1", 5),
                new Rating("u1", "m2", 3),
                new Rating("u2", "m1", 4),
                new Rating("u3", "m3", 4)), HybridCombinerTest.ITEMS, SnapshotOrigin.UPSTREAM);
    }

    @Test
    void summarizesCurrentCatalog() throws Exception {
        mockMvc.perform(get("/api/catalog/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRatings").value(4))
                .andExpect(jsonPath("$.totalItems").value(7))
                .andExpect(jsonPath("$.uniqueUsers").value(3))
                .andExpect(jsonPath("$.averageRating").value(4.0))
                .andExpect(jsonPath("$.ratingDistribution['4.0']").value(2));
    }

    @Test
    void reportsSnapshotHealth() throws Exception {
        mockMvc.perform(get("/api/catalog/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.ratingsCount").value(4))
                .andExpect(jsonPath("$.itemsCount").value(7))
                .andExpect(jsonPath("$.origin").value("UPSTREAM"))
                .andExpect(jsonPath("$.snapshotVersion").value(snapshotStore.current().version()));
    }

    @Test
    void unknownRouteIsNotServerError() throws Exception {
        mockMvc.perform(get("/api/catalog/nothing"))
                .andExpect(status().isNotFound());
    }
}
