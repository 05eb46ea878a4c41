package com.bastion.correlation;

import com.bastion.domain.AttemptRecord;
import com.bastion.domain.AuthAttempt;
import com.bastion.domain.CampaignAnalysisResult;
import com.bastion.domain.ThreatContext;
import com.bastion.domain.ThreatSignal;
import com.bastion.enrichment.ReputationAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Buffers scored authentication attempts and hands them to the campaign engine
 * in periodic batches.
 *
 * The buffer is bounded; when full, the oldest attempt is dropped.
 */
@Component
public class CampaignDetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CampaignDetectionScheduler.class);

    private final CampaignEngine engine;
    private final ReputationAnalyzer reputationAnalyzer;
    private final Clock clock;
    private final int maxBufferedAttempts;
    private final Deque<AttemptRecord> buffer = new ArrayDeque<>();

    private long dropped;

    public CampaignDetectionScheduler(CampaignEngine engine,
                                      ReputationAnalyzer reputationAnalyzer,
                                      Clock clock,
                                      @Value("${bastion.correlation.max-buffered-attempts:10000}") int maxBufferedAttempts) {
        this.engine = engine;
        this.reputationAnalyzer = reputationAnalyzer;
        this.clock = clock;
        this.maxBufferedAttempts = Math.max(1, maxBufferedAttempts);
    }

    @PostConstruct
    public void init() {
        log.info("Campaign detection scheduler buffering up to {} attempts", maxBufferedAttempts);
    }

    /**
     * Queue an attempt whose threat signal was scored upstream.
     */
    public void submit(AuthAttempt attempt, ThreatSignal signal) {
        AttemptRecord record = AttemptRecord.of(attempt, signal);
        synchronized (buffer) {
            if (buffer.size() >= maxBufferedAttempts) {
                buffer.pollFirst();
                dropped++;
                if (dropped == 1 || dropped % 1000 == 0) {
                    log.warn("Campaign detection buffer full, dropped {} oldest attempts so far", dropped);
                }
            }
            buffer.addLast(record);
        }
    }

    /**
     * Queue an attempt, scoring its threat signal from indicator and reputation data first.
     *
     * @return the attempt's threat context
     */
    public ThreatContext submit(AuthAttempt attempt) {
        ThreatContext context = reputationAnalyzer.assessAttempt(attempt);
        submit(attempt, reputationAnalyzer.toSignal(context));
        return context;
    }

    /**
     * Drain the buffer and run one detection pass over it.
     */
    public CampaignAnalysisResult runNow() {
        List<AttemptRecord> batch;
        synchronized (buffer) {
            batch = new ArrayList<>(buffer);
            buffer.clear();
        }
        if (batch.isEmpty()) {
            return CampaignAnalysisResult.empty(clock.instant());
        }
        log.debug("Running campaign detection over {} buffered attempts", batch.size());
        return engine.analyze(batch);
    }

    @Scheduled(fixedDelayString = "${bastion.correlation.schedule.fixed-delay-ms:60000}")
    public void runScheduledPass() {
        try {
            runNow();
        } catch (RuntimeException e) {
            log.error("Scheduled campaign detection pass failed", e);
        }
    }

    public int bufferedAttempts() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public long droppedAttempts() {
        synchronized (buffer) {
            return dropped;
        }
    }
}
