package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.repository.MetricSeriesBuffer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ObservationController.class)
class ObservationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetricSeriesBuffer buffer;

    @Test
    void append_accepted() throws Exception {
        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": "tx_count", "cohort": {"channel": "web"}, "values": [42.0]}
                                """))
                .andExpect(status().isAccepted());

        verify(buffer).append(Cohort.of("channel", "web"), "tx_count", 42.0);
    }

    @Test
    void append_noCohort_usesGlobal() throws Exception {
        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": "p95_latency_ms", "values": [120.0, 0.3]}
                                """))
                .andExpect(status().isAccepted());

        verify(buffer).append(Cohort.global(), "p95_latency_ms", 120.0, 0.3);
    }

    @Test
    void append_blankMetric_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": " ", "values": [1.0]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("metric"));

        verifyNoInteractions(buffer);
    }

    @Test
    void append_emptyValues_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": "tx_count", "values": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("values"));
    }

    @Test
    void append_widthMismatch_returns400() throws Exception {
        doThrow(new IllegalArgumentException("Row width 2 does not match series width 1"))
                .when(buffer).append(any(), eq("tx_count"), any(double[].class));

        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": "tx_count", "values": [1.0, 2.0]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Row width 2 does not match series width 1"));
    }

    @Test
    void append_separatorInCohortValue_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"metric": "tx_count", "cohort": {"merchant": "acme,channel=web"}, "values": [1.0]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("cohort"));

        verifyNoInteractions(buffer);
    }
}
