package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.engine.DetectorProvider;
import com.metricwatch.anomaly.engine.DetectorRegistry;
import com.metricwatch.anomaly.engine.detectors.IqrDetector;
import com.metricwatch.anomaly.engine.detectors.ZScoreDetector;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DetectorConfigServiceTest {

    @Mock
    private DetectionScheduler scheduler;

    @Mock
    private GuardrailService guardrailService;

    private DetectionProperties properties;
    private DetectorConfigService service;

    private final DetectorConfig volume = TestDataFactory.createDetectorConfig("volume", DetectorType.ZSCORE, "tx_count");
    private final DetectorConfig latency = TestDataFactory.createDetectorConfig("latency", DetectorType.IQR, "p95_latency_ms");

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        DetectorRegistry registry = new DetectorRegistry(List.of(
                DetectorProvider.of(DetectorType.ZSCORE, ZScoreDetector::new),
                DetectorProvider.of(DetectorType.IQR, IqrDetector::new)));
        service = new DetectorConfigService(properties, registry, scheduler, guardrailService);
    }

    @Test
    void init_loadsDetectorsFromProperties() {
        DetectionProperties.DetectorSettings settings = new DetectionProperties.DetectorSettings();
        settings.setId("checkout");
        settings.setDetectorType("z-score");
        settings.setMetric("tx_count");
        settings.setMinSupport(10);
        settings.setCohorts(List.of(Map.of("channel", "web")));
        properties.setDetectors(List.of(settings));

        service.init();

        assertThat(service.findAll()).hasSize(1);
        DetectorConfig loaded = service.findById("checkout").orElseThrow();
        assertThat(loaded.getDetectorType()).isEqualTo(DetectorType.ZSCORE);
        assertThat(loaded.getCohorts()).hasSize(1);
        verify(scheduler).refreshJobs(List.of(loaded));
    }

    @Test
    void reload_replacesSetAndRefreshesScheduler() {
        service.reload(List.of(volume, latency));

        assertThat(service.findAll()).containsExactly(volume, latency);
        verify(scheduler).refreshJobs(List.of(volume, latency));
    }

    @Test
    void reload_invalidConfig_keepsCurrentSet() {
        service.reload(List.of(volume));
        DetectorConfig broken = latency.toBuilder().hysteresisRaiseK(2.0).hysteresisClearK(3.0).build();

        assertThatThrownBy(() -> service.reload(List.of(volume, broken)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("latency")
                .hasMessageContaining("hysteresisRaiseK");

        assertThat(service.findAll()).containsExactly(volume);
        verify(scheduler, times(1)).refreshJobs(anyList());
    }

    @Test
    void reload_duplicateIds_rejected() {
        DetectorConfig twin = latency.toBuilder().id("volume").build();

        assertThatThrownBy(() -> service.reload(List.of(volume, twin)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate detector id: volume");
        verify(scheduler, never()).refreshJobs(anyList());
    }

    @Test
    void reload_unregisteredType_rejected() {
        DetectorConfig threshold = TestDataFactory.createDetectorConfig("cap", DetectorType.THRESHOLD, "errors");

        assertThatThrownBy(() -> service.reload(List.of(threshold)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unsupported type THRESHOLD");
        assertThat(service.findAll()).isEmpty();
    }

    @Test
    void upsert_addsOrReplacesDetector() {
        service.reload(List.of(volume));

        service.upsert(latency);
        DetectorConfig retuned = volume.toBuilder().k(2.5).build();
        service.upsert(retuned);

        assertThat(service.findAll()).containsExactly(retuned, latency);
        verify(scheduler).refreshJobs(List.of(retuned, latency));
    }

    @Test
    void upsert_secondEnabledDetectorOnSameMetric_isRejected() {
        service.reload(List.of(volume));
        DetectorConfig volumeIqr = TestDataFactory.createDetectorConfig("volume-iqr", DetectorType.IQR, "tx_count");

        assertThatThrownBy(() -> service.upsert(volumeIqr))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("both enabled on metric tx_count");

        assertThat(service.findAll()).containsExactly(volume);
        verify(scheduler, times(1)).refreshJobs(anyList());
    }

    @Test
    void remove_existing_forgetsGuardrailEngine() {
        service.reload(List.of(volume, latency));

        boolean removed = service.remove("volume");

        assertThat(removed).isTrue();
        assertThat(service.findById("volume")).isEmpty();
        verify(guardrailService).forget("volume");
        verify(scheduler).refreshJobs(List.of(latency));
    }

    @Test
    void remove_unknown_returnsFalse() {
        service.reload(List.of(volume));

        assertThat(service.remove("missing")).isFalse();
        verify(scheduler, times(1)).refreshJobs(anyList());
        verify(guardrailService, never()).forget(any());
    }
}
