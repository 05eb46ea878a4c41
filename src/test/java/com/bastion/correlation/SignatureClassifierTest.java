package com.bastion.correlation;

import com.bastion.domain.AuthAttempt;
import com.bastion.domain.CampaignEvent;
import com.bastion.domain.CampaignType;
import com.bastion.domain.GeoLocation;
import com.bastion.domain.ThreatActor;
import com.bastion.domain.ThreatSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.bastion.correlation.CampaignFixtures.T0;
import static com.bastion.correlation.CampaignFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SignatureClassifier Tests")
class SignatureClassifierTest {

    private final SignatureClassifier classifier = new SignatureClassifier(SignatureCatalog.defaults());

    private static List<CampaignEvent> burst(int count, long gapSeconds, int ips, int users) {
        List<CampaignEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(event("e" + i, T0.plusSeconds(i * gapSeconds),
                "192.0.2." + (i % ips), "user" + (i % users) + "@example.com", "python-requests/2.31"));
        }
        return events;
    }

    @Test
    @DisplayName("Should match rapid brute force from one source")
    void shouldMatchBruteForce() {
        Classification classification = classifier.classify(burst(6, 10, 1, 6));

        assertThat(classification.getCampaignType()).isEqualTo(CampaignType.BRUTE_FORCE);
        assertThat(classification.getThreatActor()).isEqualTo(ThreatActor.AUTOMATED_TOOL);
        assertThat(classification.getConfidence()).isEqualTo(1.0);
        assertThat(classification.getSignatureId()).isEqualTo("bf_rapid_attempts");
    }

    @Test
    @DisplayName("Should match a botnet with uniform timing across many sources")
    void shouldMatchBotnet() {
        Classification classification = classifier.classify(burst(8, 30, 8, 8));

        assertThat(classification.getCampaignType()).isEqualTo(CampaignType.BOTNET_ACTIVITY);
        assertThat(classification.isFromSignature()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to brute force when no signature clears its threshold")
    void shouldFallBackToBruteForce() {
        // 60 second gaps are not rapid, so the brute force signature scores 2/3
        Classification classification = classifier.classify(burst(5, 60, 1, 5));

        assertThat(classification.isFromSignature()).isFalse();
        assertThat(classification.getCampaignType()).isEqualTo(CampaignType.BRUTE_FORCE);
        assertThat(classification.getThreatActor()).isEqualTo(ThreatActor.AUTOMATED_TOOL);
        assertThat(classification.getConfidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Should apply the coarse spread heuristics in order")
    void shouldApplyFallbackHeuristics() {
        assertThat(classifier.fallback(burst(6, 600, 6, 2)).getCampaignType()).isEqualTo(CampaignType.CREDENTIAL_STUFFING);
        assertThat(classifier.fallback(burst(5, 600, 4, 5)).getCampaignType()).isEqualTo(CampaignType.DISTRIBUTED_ATTACK);
        Classification unknown = classifier.fallback(burst(2, 600, 2, 2));
        assertThat(unknown.getCampaignType()).isEqualTo(CampaignType.UNKNOWN);
        assertThat(unknown.getThreatActor()).isNull();
        assertThat(unknown.getConfidence()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Should prefer the earlier signature on equal scores")
    void shouldBreakTiesByCatalogueOrder() {
        AttackSignature first = new AttackSignature("first", "First", null,
            List.of(IndicatorPredicate.SAME_IP), 0.5, CampaignType.BRUTE_FORCE, null);
        AttackSignature second = new AttackSignature("second", "Second", null,
            List.of(IndicatorPredicate.SAME_IP), 0.5, CampaignType.BOTNET_ACTIVITY, null);
        SignatureClassifier ordered = new SignatureClassifier(new SignatureCatalog(List.of(first, second)));

        assertThat(ordered.classify(burst(3, 10, 1, 3)).getSignatureId()).isEqualTo("first");
    }

    @Test
    @DisplayName("Should never lower a signature score when events are added")
    void shouldScoreMonotonicallyForGrowingEvidence() {
        // Given: predicates that can only flip from false to true as events are added
        AttackSignature signature = new AttackSignature("grow", "Grow", null,
            List.of(IndicatorPredicate.MULTIPLE_IPS, IndicatorPredicate.DISTRIBUTED_SOURCES,
                IndicatorPredicate.ADVANCED_EVASION, IndicatorPredicate.DEVICE_CHANGE),
            0.5, CampaignType.DISTRIBUTED_ATTACK, null);
        List<CampaignEvent> events = new ArrayList<>();
        double previous = 0.0;

        // When / Then
        for (int i = 0; i < 8; i++) {
            AuthAttempt attempt = AuthAttempt.builder()
                .clientIp("198.51.100." + i)
                .email("user@example.com")
                .userAgent("agent-" + (i % 2))
                .tor(i == 6)
                .timestamp(T0.plusSeconds(i))
                .build();
            events.add(new CampaignEvent("e" + i, T0.plusSeconds(i), attempt, ThreatSignal.empty(), 0.5));
            double score = classifier.score(events, signature);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
        assertThat(previous).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should evaluate predicates against their definitions")
    void shouldEvaluatePredicates() {
        Instant t = T0;
        List<CampaignEvent> rapid = List.of(
            event("a", t, "192.0.2.1", "u@example.com", "ua"),
            event("b", t.plusSeconds(59), "192.0.2.1", "u@example.com", "ua"));
        List<CampaignEvent> slow = List.of(
            event("a", t, "192.0.2.1", "u@example.com", "ua"),
            event("b", t.plusSeconds(60), "192.0.2.1", "u@example.com", "ua"),
            event("c", t.plusSeconds(3700), "192.0.2.1", "u@example.com", "ua"));

        assertThat(IndicatorPredicate.RAPID_ATTEMPTS.test(rapid)).isTrue();
        assertThat(IndicatorPredicate.RAPID_ATTEMPTS.test(slow)).isFalse();
        assertThat(IndicatorPredicate.PERSISTENT_ATTEMPTS.test(slow)).isTrue();
        assertThat(IndicatorPredicate.COORDINATED_TIMING.test(slow)).isFalse();
        assertThat(IndicatorPredicate.SAME_IP.test(List.of())).isFalse();
        assertThat(IndicatorPredicate.LOW_SUCCESS_RATE.test(List.of())).isFalse();

        AuthAttempt away = AuthAttempt.builder()
            .clientIp("192.0.2.1")
            .geolocation(new GeoLocation("BR", 0, 0, false))
            .loginSucceeded(true)
            .timestamp(t)
            .build();
        List<CampaignEvent> takeover = List.of(new CampaignEvent("x", t, away, ThreatSignal.empty(), 0.5));
        assertThat(IndicatorPredicate.LOCATION_ANOMALY.test(takeover)).isTrue();
        assertThat(IndicatorPredicate.SUCCESSFUL_LOGIN.test(takeover)).isTrue();
        assertThat(IndicatorPredicate.MULTIPLE_FAILURES.test(takeover)).isFalse();
    }

    @Test
    @DisplayName("Should resolve predicates by their configuration name")
    void shouldResolvePredicateNames() {
        assertThat(IndicatorPredicate.fromName("coordinated_timing")).isEqualTo(IndicatorPredicate.COORDINATED_TIMING);
        assertThat(IndicatorPredicate.fromName("SAME_IP")).isEqualTo(IndicatorPredicate.SAME_IP);
        assertThat(IndicatorPredicate.values()).hasSize(15);
    }
}
