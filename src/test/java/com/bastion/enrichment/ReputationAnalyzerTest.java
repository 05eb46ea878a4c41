package com.bastion.enrichment;

import com.bastion.domain.AuthAttempt;
import com.bastion.domain.IndicatorKind;
import com.bastion.domain.ReputationLevel;
import com.bastion.domain.ReputationVerdict;
import com.bastion.domain.ThreatContext;
import com.bastion.domain.ThreatIndicator;
import com.bastion.domain.ThreatSignal;
import com.bastion.storage.IndicatorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ReputationAnalyzer Tests")
class ReputationAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private IndicatorStore indicatorStore;
    private EnrichmentMetrics metrics;

    @BeforeEach
    void setUp() {
        indicatorStore = new IndicatorStore(Clock.fixed(NOW, ZoneOffset.UTC));
        metrics = new EnrichmentMetrics(new SimpleMeterRegistry());
    }

    private ReputationAnalyzer analyzer(ReputationSource... sources) {
        ReputationFeedClient client = new ReputationFeedClient(List.of(sources), Duration.ofHours(1),
            Duration.ofSeconds(1), 4, metrics);
        return new ReputationAnalyzer(indicatorStore, client, metrics, 3600, 1000);
    }

    private void addIndicator(IndicatorKind kind, String value, ReputationLevel level, double confidence, String... tags) {
        indicatorStore.add(ThreatIndicator.builder()
            .kind(kind)
            .value(value)
            .reputationLevel(level)
            .confidence(confidence)
            .source("local")
            .tags(List.of(tags))
            .lastSeen(NOW)
            .build());
    }

    @Test
    @DisplayName("Should report clean with no matches and no feeds")
    void shouldReportClean() {
        ReputationVerdict verdict = analyzer().analyzeIP("192.0.2.1");

        assertThat(verdict.getReputationLevel()).isEqualTo(ReputationLevel.CLEAN);
        assertThat(verdict.getConfidence()).isZero();
        assertThat(verdict.getSources()).isEmpty();
    }

    @Test
    @DisplayName("Should seed the verdict from the most severe local match")
    void shouldSeedFromLocalMatch() {
        addIndicator(IndicatorKind.CIDR, "10.0.0.0/8", ReputationLevel.SUSPICIOUS, 0.6, "corp");
        addIndicator(IndicatorKind.IP, "10.1.1.1", ReputationLevel.MALICIOUS, 0.8, "botnet");

        ReputationVerdict verdict = analyzer().analyzeIP("10.1.1.1");

        assertThat(verdict.getReputationLevel()).isEqualTo(ReputationLevel.MALICIOUS);
        assertThat(verdict.getConfidence()).isEqualTo(0.8);
        assertThat(verdict.getTags()).contains("corp", "botnet");
        assertThat(verdict.getFirstSeen()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should escalate past a feed's cutoffs")
    void shouldEscalateFromFeed() {
        ReputationVerdict verdict = analyzer(StubReputationSource.fixed("feed", 0.7, "tor")).analyzeIP("192.0.2.1");

        assertThat(verdict.getReputationLevel()).isEqualTo(ReputationLevel.MALICIOUS);
        assertThat(verdict.getConfidence()).isEqualTo(0.7);
        assertThat(verdict.getSources()).containsExactly("feed");
        assertThat(verdict.getTags()).containsExactly("tor");
        assertThat(verdict.getAdditionalInfo()).containsKey("feed");
    }

    @Test
    @DisplayName("Should never downgrade a local verdict from a low feed signal")
    void shouldNeverDowngrade() {
        // Given
        addIndicator(IndicatorKind.IP, "192.0.2.1", ReputationLevel.CRITICAL, 0.95);

        // When
        ReputationVerdict verdict = analyzer(
            StubReputationSource.fixed("low", 0.3),
            StubReputationSource.fixed("none", 0.0)).analyzeIP("192.0.2.1");

        // Then
        assertThat(verdict.getReputationLevel()).isEqualTo(ReputationLevel.CRITICAL);
        assertThat(verdict.getConfidence()).isEqualTo(0.95);
        assertThat(verdict.getSources()).containsExactly("local", "low", "none");
    }

    @Test
    @DisplayName("Should mark suspicious between the cutoffs")
    void shouldMarkSuspicious() {
        ReputationVerdict verdict = analyzer(StubReputationSource.fixed("feed", 0.3)).analyzeIP("192.0.2.1");

        assertThat(verdict.getReputationLevel()).isEqualTo(ReputationLevel.SUSPICIOUS);
    }

    @Test
    @DisplayName("Should serve repeated analyses from the verdict cache until invalidated")
    void shouldCacheVerdicts() {
        StubReputationSource feed = StubReputationSource.fixed("feed", 0.7);
        ReputationAnalyzer analyzer = analyzer(feed);

        ReputationVerdict first = analyzer.analyzeIP("192.0.2.1");
        ReputationVerdict second = analyzer.analyzeIP("192.0.2.1");

        assertThat(second).isSameAs(first);
        assertThat(metrics.getVerdictCacheHitRate()).isEqualTo(50.0);

        analyzer.invalidate("192.0.2.1");
        analyzer.analyzeIP("192.0.2.1");
        assertThat(feed.calls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should assess an attempt from IP, user agent and email indicators")
    void shouldAssessAttempt() {
        // Given
        indicatorStore.seedDefaults();
        addIndicator(IndicatorKind.IP, "192.0.2.1", ReputationLevel.MALICIOUS, 0.8, "botnet");
        addIndicator(IndicatorKind.EMAIL, "victim@example.com", ReputationLevel.SUSPICIOUS, 0.5, "targeted");
        AuthAttempt attempt = AuthAttempt.builder()
            .clientIp("192.0.2.1")
            .userAgent("sqlmap/1.7")
            .email("victim@example.com")
            .timestamp(NOW)
            .build();

        // When
        ThreatContext context = analyzer().assessAttempt(attempt);

        // Then
        assertThat(context.getMatchedIndicators()).extracting(ThreatIndicator::getValue)
            .containsExactly("192.0.2.1", "sqlmap", "victim@example.com");
        assertThat(context.getThreatCategories()).contains("botnet", "scanner", "targeted");
        assertThat(context.getAttribution()).isEqualTo("Botnet (based on 192.0.2.1)");
        assertThat(context.getRiskScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should weight verdict and indicators into a capped risk score")
    void shouldComputeRiskScore() {
        ReputationVerdict verdict = new ReputationVerdict("192.0.2.1", ReputationLevel.SUSPICIOUS, 0.5,
            null, null, null, null, null);
        ThreatIndicator indicator = ThreatIndicator.builder()
            .kind(IndicatorKind.IP).value("192.0.2.1")
            .reputationLevel(ReputationLevel.SUSPICIOUS).confidence(0.5)
            .build();

        assertThat(ReputationAnalyzer.riskScore(verdict, List.of(indicator))).isCloseTo(0.25, within(1e-9));
        assertThat(ReputationAnalyzer.riskScore(ReputationVerdict.clean("192.0.2.1"), List.of())).isZero();
    }

    @Test
    @DisplayName("Should turn a threat context into a campaign signal")
    void shouldBuildSignal() {
        indicatorStore.seedDefaults();
        ReputationAnalyzer analyzer = analyzer();
        ThreatContext context = analyzer.assessAttempt(AuthAttempt.builder()
            .clientIp("192.0.2.1").userAgent("sqlmap").build());

        ThreatSignal signal = analyzer.toSignal(context);

        assertThat(signal.getIpReputationScore()).isEqualTo(context.getRiskScore());
        assertThat(signal.getKnownAttackPatterns()).contains("sql_injection", "scanner");
        assertThat(signal.getThreatActorIndicators()).containsExactly("Automated Scanner (based on sqlmap)");
    }
}
