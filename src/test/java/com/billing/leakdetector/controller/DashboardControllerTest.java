package com.billing.leakdetector.controller;

import com.billing.leakdetector.model.AggregationSnapshot;
import com.billing.leakdetector.service.AggregationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AggregationService aggregationService;

    @Test
    void metrics_success() throws Exception {
        when(aggregationService.snapshot()).thenReturn(AggregationSnapshot.builder()
                .totalUploads(4)
                .totalRows(6000)
                .totalAnomalies(5870)
                .averageScore(0.231)
                .highSeverityCount(120)
                .mediumSeverityCount(700)
                .lowSeverityCount(5050)
                .unreviewedCount(5800)
                .lastUpdated(1_700_000_000_000L)
                .build());

        mockMvc.perform(get("/api/v1/dashboard/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalUploads").value(4))
                .andExpect(jsonPath("$.totalAnomalies").value(5870))
                .andExpect(jsonPath("$.highSeverityCount").value(120))
                .andExpect(jsonPath("$.averageScore").value(0.231));
    }
}
