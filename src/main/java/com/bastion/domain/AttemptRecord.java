package com.bastion.domain;

/**
 * An authentication attempt paired with the threat signal scored for it.
 * This is the unit of input to a campaign detection pass.
 */
public final class AttemptRecord {

    private final AuthAttempt attempt;
    private final ThreatSignal signal;

    public AttemptRecord(AuthAttempt attempt, ThreatSignal signal) {
        if (attempt == null) {
            throw new IllegalArgumentException("Attempt must not be null");
        }
        this.attempt = attempt;
        this.signal = signal != null ? signal : ThreatSignal.empty();
    }

    public static AttemptRecord of(AuthAttempt attempt, ThreatSignal signal) {
        return new AttemptRecord(attempt, signal);
    }

    public AuthAttempt getAttempt() {
        return attempt;
    }

    public ThreatSignal getSignal() {
        return signal;
    }
}
