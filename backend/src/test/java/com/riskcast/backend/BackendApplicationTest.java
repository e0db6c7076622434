package com.riskcast.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.service.validation.ValidationHistoryStore;
import com.riskcast.backend.service.validation.InMemoryValidationHistoryStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "riskcast.cache.prefetch.enabled=false",
        "riskcast.validation.schedule.enabled=false"
})
@AutoConfigureMockMvc
class BackendApplicationTest {

    private static final String REQUEST = """
            {"businessName": "Harbour Freight Ltd", "industry": "Manufacturing", "country": "gb",
             "email": "ops@harbour.example", "predictionHorizons": [12, 3, 4],
             "includeModelComparison": true, "includeUncertainty": true,
             "metadata": {"business_age_years": 12, "credit_score": 720}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ValidationHistoryStore validationHistoryStore;

    @Test
    void runsWithoutDatabaseOnInMemoryStores() {
        assertThat(validationHistoryStore).isInstanceOf(InMemoryValidationHistoryStore.class);
    }

    @Test
    void assessesWithBundledModelsAndServesRepeatFromCache() throws Exception {
        String first = mockMvc.perform(post("/api/v1/risk/assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "req-1")
                        .content(REQUEST))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-1"))
                .andExpect(jsonPath("$.horizons['3'].modelUsed").value("short"))
                .andExpect(jsonPath("$.horizons['4'].modelUsed").value("ensemble"))
                .andExpect(jsonPath("$.horizons['12'].modelUsed").value("long"))
                .andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(post("/api/v1/risk/assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertThat(second).isEqualTo(first);
        JsonNode horizons = objectMapper.readTree(first).get("horizons");
        assertThat(horizons.fieldNames()).toIterable().containsExactly("3", "4", "12");
        for (JsonNode horizon : horizons) {
            double score = horizon.get("score").asDouble();
            assertThat(score).isBetween(0.0, 1.0);
            assertThat(horizon.get("uncertainty").get("lower").asDouble()).isLessThanOrEqualTo(score);
            assertThat(horizon.get("uncertainty").get("upper").asDouble()).isGreaterThanOrEqualTo(score);
        }

        mockMvc.perform(get("/api/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.local.hits").value(1));
    }

    @Test
    void rejectsUnsupportedHorizon() throws Exception {
        mockMvc.perform(post("/api/v1/risk/assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"businessName\": \"X\", \"industry\": \"retail\", \"country\": \"US\", \"predictionHorizons\": [36]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_INPUT"))
                .andExpect(jsonPath("$.requestId").exists());
    }

    @Test
    void exposesBreakerState() throws Exception {
        mockMvc.perform(get("/api/v1/risk/breaker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"));
    }

    @Test
    void listsBundledModelsAsLoaded() throws Exception {
        mockMvc.perform(get("/api/v1/risk/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].slot").value("short"))
                .andExpect(jsonPath("$[0].loaded").value(true))
                .andExpect(jsonPath("$[1].slot").value("long"))
                .andExpect(jsonPath("$[1].loaded").value(true));
    }
}
