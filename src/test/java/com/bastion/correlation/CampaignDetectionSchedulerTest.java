package com.bastion.correlation;

import com.bastion.domain.AttemptRecord;
import com.bastion.domain.AuthAttempt;
import com.bastion.domain.CampaignAnalysisResult;
import com.bastion.domain.ReputationVerdict;
import com.bastion.domain.ThreatContext;
import com.bastion.domain.ThreatSignal;
import com.bastion.enrichment.ReputationAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.bastion.correlation.CampaignFixtures.T0;
import static com.bastion.correlation.CampaignFixtures.attempt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CampaignDetectionScheduler Tests")
class CampaignDetectionSchedulerTest {

    @Mock
    private CampaignEngine engine;

    @Mock
    private ReputationAnalyzer reputationAnalyzer;

    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(T0, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Should hand buffered attempts to the engine and clear the buffer")
    @SuppressWarnings("unchecked")
    void shouldRunBufferedAttempts() {
        // Given
        CampaignDetectionScheduler scheduler = new CampaignDetectionScheduler(engine, reputationAnalyzer, clock, 100);
        when(engine.analyze(anyList())).thenReturn(CampaignAnalysisResult.empty(T0));
        scheduler.submit(attempt("r1", T0, "192.0.2.1", "a@example.com", "ua"), ThreatSignal.empty());
        scheduler.submit(attempt("r2", T0, "192.0.2.1", "b@example.com", "ua"), ThreatSignal.empty());

        // When
        scheduler.runNow();

        // Then
        ArgumentCaptor<List<AttemptRecord>> batch = ArgumentCaptor.forClass(List.class);
        verify(engine).analyze(batch.capture());
        assertThat(batch.getValue()).extracting(r -> r.getAttempt().getRequestId()).containsExactly("r1", "r2");
        assertThat(scheduler.bufferedAttempts()).isZero();
    }

    @Test
    @DisplayName("Should skip the engine when nothing is buffered")
    void shouldSkipEmptyBuffer() {
        CampaignDetectionScheduler scheduler = new CampaignDetectionScheduler(engine, reputationAnalyzer, clock, 100);

        CampaignAnalysisResult result = scheduler.runNow();

        assertThat(result.getDetectedCampaigns()).isEmpty();
        verify(engine, never()).analyze(any());
    }

    @Test
    @DisplayName("Should drop the oldest attempts when the buffer is full")
    @SuppressWarnings("unchecked")
    void shouldDropOldestWhenFull() {
        // Given
        CampaignDetectionScheduler scheduler = new CampaignDetectionScheduler(engine, reputationAnalyzer, clock, 2);
        when(engine.analyze(anyList())).thenReturn(CampaignAnalysisResult.empty(T0));

        // When
        for (int i = 0; i < 5; i++) {
            scheduler.submit(attempt("r" + i, T0, "192.0.2.1", "a@example.com", "ua"), null);
        }
        scheduler.runScheduledPass();

        // Then
        ArgumentCaptor<List<AttemptRecord>> batch = ArgumentCaptor.forClass(List.class);
        verify(engine).analyze(batch.capture());
        assertThat(batch.getValue()).extracting(r -> r.getAttempt().getRequestId()).containsExactly("r3", "r4");
        assertThat(scheduler.droppedAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should score unscored attempts before buffering them")
    void shouldScoreUnscoredAttempts() {
        // Given
        CampaignDetectionScheduler scheduler = new CampaignDetectionScheduler(engine, reputationAnalyzer, clock, 100);
        AuthAttempt attempt = attempt("r1", T0, "192.0.2.1", "a@example.com", "sqlmap");
        ThreatContext context = new ThreatContext(ReputationVerdict.clean("192.0.2.1"), List.of(), 0.4, List.of(), null);
        ThreatSignal signal = new ThreatSignal(0.4, List.of("scanner"), 0);
        when(reputationAnalyzer.assessAttempt(attempt)).thenReturn(context);
        when(reputationAnalyzer.toSignal(context)).thenReturn(signal);

        // When
        ThreatContext returned = scheduler.submit(attempt);

        // Then
        assertThat(returned).isSameAs(context);
        assertThat(scheduler.bufferedAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the schedule alive when a pass throws")
    void shouldSurviveFailingPass() {
        CampaignDetectionScheduler scheduler = new CampaignDetectionScheduler(engine, reputationAnalyzer, clock, 100);
        when(engine.analyze(anyList())).thenThrow(new IllegalStateException("boom"));
        scheduler.submit(attempt("r1", T0, "192.0.2.1", "a@example.com", "ua"), ThreatSignal.empty());

        scheduler.runScheduledPass();

        assertThat(scheduler.bufferedAttempts()).isZero();
    }
}
