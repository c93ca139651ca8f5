package com.metricwatch.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.service.DetectionScheduler;
import com.metricwatch.anomaly.service.DetectorConfigService;
import com.metricwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectorController.class)
class DetectorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DetectorConfigService configService;

    @MockBean
    private DetectionScheduler scheduler;

    private final DetectorConfig volume = TestDataFactory
            .createDetectorConfig("checkout-volume", DetectorType.ZSCORE, "tx_count")
            .toBuilder()
            .cohort(Cohort.of("channel", "web"))
            .build();

    @Test
    void listDetectors_success() throws Exception {
        when(configService.findAll()).thenReturn(List.of(volume));

        mockMvc.perform(get("/api/v1/detectors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].id").value("checkout-volume"))
                .andExpect(jsonPath("$[0].detectorType").value("ZSCORE"))
                .andExpect(jsonPath("$[0].cohorts[0].channel").value("web"))
                .andExpect(jsonPath("$[0].hysteresisRaiseK").value(4.0));
    }

    @Test
    void getDetector_found() throws Exception {
        when(configService.findById("checkout-volume")).thenReturn(Optional.of(volume));

        mockMvc.perform(get("/api/v1/detectors/checkout-volume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metric").value("tx_count"))
                .andExpect(jsonPath("$.k").value(3.5));
    }

    @Test
    void getDetector_notFound() throws Exception {
        when(configService.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/detectors/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void upsertDetector_success() throws Exception {
        when(configService.upsert(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(put("/api/v1/detectors/checkout-volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"detectorType": "z-score", "metric": "tx_count", "k": 2.5,
                                 "cohorts": [{"channel": "web"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("checkout-volume"))
                .andExpect(jsonPath("$.detectorType").value("ZSCORE"))
                .andExpect(jsonPath("$.k").value(2.5))
                .andExpect(jsonPath("$.windowSize").value(96));

        verify(configService).upsert(argThat(config ->
                config.getId().equals("checkout-volume")
                        && config.getCohorts().equals(List.of(Cohort.of("channel", "web")))));
    }

    @Test
    void upsertDetector_idMismatch_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/detectors/other")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(volume)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("does not match")));

        verify(configService, never()).upsert(any());
    }

    @Test
    void upsertDetector_invalid_returns400() throws Exception {
        when(configService.upsert(any())).thenThrow(new IllegalStateException(
                "Detector configuration validation failed:\n  - checkout-volume: hysteresisRaiseK (2.0) must be greater than hysteresisClearK (3.0)"));

        mockMvc.perform(put("/api/v1/detectors/checkout-volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(volume)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("hysteresisRaiseK")));
    }

    @Test
    void deleteDetector_success() throws Exception {
        when(configService.remove("checkout-volume")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/detectors/checkout-volume"))
                .andExpect(status().isNoContent());
    }

    @Test
    void deleteDetector_notFound() throws Exception {
        when(configService.remove("missing")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/detectors/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void runDetector_success() throws Exception {
        when(configService.findById("checkout-volume")).thenReturn(Optional.of(volume));
        when(scheduler.runNow("checkout-volume"))
                .thenReturn(Optional.of(TestDataFactory.createJobRunSummary("checkout-volume", 1, 1)));

        mockMvc.perform(post("/api/v1/detectors/checkout-volume/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detectorId").value("checkout-volume"))
                .andExpect(jsonPath("$.cohortsEvaluated").value(1))
                .andExpect(jsonPath("$.eventsEmitted").value(1));
    }

    @Test
    void runDetector_unknown_returns404() throws Exception {
        when(configService.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/detectors/missing/run"))
                .andExpect(status().isNotFound());

        verify(scheduler, never()).runNow(any());
    }

    @Test
    void runDetector_schedulingDisabled_returns409() throws Exception {
        when(configService.findById("checkout-volume")).thenReturn(Optional.of(volume));
        when(scheduler.runNow("checkout-volume")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/detectors/checkout-volume/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Detection scheduling is disabled"));
    }
}
