package com.bastion.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DensityClusterer Tests")
class DensityClustererTest {

    @Test
    @DisplayName("Should separate two dense groups and mark the outlier as noise")
    void shouldSeparateGroups() {
        // Given
        double[][] features = {
            {0.0, 0.0}, {0.1, 0.0}, {0.0, 0.1}, {0.1, 0.1},
            {10.0, 10.0}, {10.1, 10.0}, {10.0, 10.1},
            {5.0, -20.0}
        };
        DensityClusterer clusterer = new DensityClusterer(0.5, 3);

        // When
        int[] labels = clusterer.cluster(features);

        // Then
        assertThat(labels[0]).isEqualTo(labels[1]).isEqualTo(labels[2]).isEqualTo(labels[3]);
        assertThat(labels[4]).isEqualTo(labels[5]).isEqualTo(labels[6]);
        assertThat(labels[0]).isNotEqualTo(labels[4]);
        assertThat(labels[0]).isNotEqualTo(DensityClusterer.NOISE);
        assertThat(labels[7]).isEqualTo(DensityClusterer.NOISE);
    }

    @Test
    @DisplayName("Should put identical points into one cluster")
    void shouldClusterIdenticalPoints() {
        double[][] features = new double[5][10];

        int[] labels = new DensityClusterer(0.5, 3).cluster(features);

        assertThat(labels).containsOnly(0);
    }

    @Test
    @DisplayName("Should label everything as noise when groups are too small")
    void shouldLabelSmallGroupsAsNoise() {
        double[][] features = {{0.0}, {100.0}};

        int[] labels = new DensityClusterer(0.5, 3).cluster(features);

        assertThat(labels).containsOnly(DensityClusterer.NOISE);
    }

    @Test
    @DisplayName("Should standardise columns and zero out constant ones")
    void shouldStandardize() {
        double[][] standardized = DensityClusterer.standardize(new double[][]{{1.0, 7.0}, {3.0, 7.0}});

        assertThat(standardized[0]).containsExactly(-1.0, 0.0);
        assertThat(standardized[1]).containsExactly(1.0, 0.0);
    }

    @Test
    @DisplayName("Should reject non-finite features and invalid parameters")
    void shouldRejectInvalidInput() {
        DensityClusterer clusterer = new DensityClusterer(0.5, 3);

        assertThatThrownBy(() -> clusterer.cluster(new double[][]{{1.0}, {Double.NaN}, {2.0}}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> clusterer.cluster(new double[][]{{1.0, 2.0}, {1.0}}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DensityClusterer(0.0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DensityClusterer(0.5, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(clusterer.cluster(new double[0][])).isEmpty();
    }
}
