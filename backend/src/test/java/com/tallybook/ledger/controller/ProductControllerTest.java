package com.tallybook.ledger.controller;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.matching.MatchCandidate;
import com.tallybook.ledger.matching.ProductMatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProductController.class)
@ActiveProfiles("test")
class ProductControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private ProductMatcher productMatcher;
    @MockBean private ImportSettings settings;

    @Test
    void normalizesNameBeforeMatchingWithConfiguredDefaults() throws Exception {
        when(settings.getMatchThreshold()).thenReturn(90);
        when(settings.getMatchLimit()).thenReturn(3);
        when(productMatcher.match("widget a", 90, 3))
                .thenReturn(List.of(new MatchCandidate(7L, "Widget A", "widget a", 100)));

        mockMvc.perform(get("/api/products/match").param("name", "  Widget A (export) "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].productId").value(7))
                .andExpect(jsonPath("$[0].score").value(100));
    }

    @Test
    void explicitThresholdAndLimitAreClamped() throws Exception {
        when(productMatcher.match("bolt", 100, 1)).thenReturn(List.of());

        mockMvc.perform(get("/api/products/match")
                        .param("name", "Bolt")
                        .param("threshold", "150")
                        .param("limit", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
