package com.bastion.correlation;

import com.bastion.domain.CampaignEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.bastion.correlation.CampaignFixtures.T0;
import static com.bastion.correlation.CampaignFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("CampaignGrouper Tests")
class CampaignGrouperTest {

    private SimpleMeterRegistry registry;
    private CampaignMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CampaignMetrics(registry);
    }

    @Test
    @DisplayName("Should group small batches by client IP")
    void shouldGroupSmallBatchesByIp() {
        CampaignGrouper grouper = new CampaignGrouper(new EventFeaturizer(), new DensityClusterer(0.5, 3), metrics);
        List<CampaignEvent> events = List.of(
            event("e1", T0, "192.0.2.1", "a@example.com", "ua"),
            event("e2", T0.plusSeconds(5), "192.0.2.2", "b@example.com", "ua"));

        Map<String, List<CampaignEvent>> groups = grouper.group(events);

        assertThat(groups).containsOnlyKeys("ip:192.0.2.1", "ip:192.0.2.2");
    }

    @Test
    @DisplayName("Should cluster uniform events into a single group")
    void shouldClusterUniformEvents() {
        // Given: identical features apart from the user
        CampaignGrouper grouper = new CampaignGrouper(new EventFeaturizer(), new DensityClusterer(0.5, 3), metrics);
        List<CampaignEvent> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            events.add(event("e" + i, T0.plusSeconds(i), "192.0.2.1", "user" + i + "@example.com", "ua"));
        }

        // When
        Map<String, List<CampaignEvent>> groups = grouper.group(events);

        // Then
        assertThat(groups).containsOnlyKeys("cluster_0");
        assertThat(groups.get("cluster_0")).hasSize(6);
    }

    @Test
    @DisplayName("Should fall back to IP grouping when clustering fails")
    void shouldFallBackWhenClusteringFails() {
        // Given
        DensityClusterer failing = mock(DensityClusterer.class);
        when(failing.getMinSamples()).thenReturn(3);
        when(failing.cluster(any())).thenThrow(new IllegalStateException("degenerate input"));
        CampaignGrouper grouper = new CampaignGrouper(new EventFeaturizer(), failing, metrics);
        List<CampaignEvent> events = List.of(
            event("e1", T0, "192.0.2.1", "a@example.com", "ua"),
            event("e2", T0, "192.0.2.1", "b@example.com", "ua"),
            event("e3", T0, "192.0.2.9", "c@example.com", "ua"));

        // When
        Map<String, List<CampaignEvent>> groups = grouper.group(events);

        // Then
        assertThat(groups.get("ip:192.0.2.1")).hasSize(2);
        assertThat(groups.get("ip:192.0.2.9")).hasSize(1);
        assertThat(registry.counter("bastion.campaign.clustering.fallbacks", "component", "campaign").count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return no groups for no events")
    void shouldHandleEmptyBatch() {
        CampaignGrouper grouper = new CampaignGrouper(new EventFeaturizer(), new DensityClusterer(0.5, 3), metrics);

        assertThat(grouper.group(List.of())).isEmpty();
    }
}
