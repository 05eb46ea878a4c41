package com.bastion.correlation;

import com.bastion.domain.AuthAttempt;
import com.bastion.domain.CampaignEvent;
import com.bastion.domain.GeoLocation;
import com.bastion.domain.ThreatSignal;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Turns campaign events into fixed-length numeric feature vectors for clustering.
 *
 * Feature vector: [hour_of_day, day_of_week, ip_hash, user_agent_hash,
 * ip_reputation, known_pattern_count, similar_attacks, latitude, longitude, anonymized].
 * Time fields are taken in UTC with Monday as day 0. Missing values become 0.
 */
@Component
public class EventFeaturizer {

    public static final int FEATURE_COUNT = 10;

    private static final int HASH_BUCKETS = 10_000;

    public double[] featurize(CampaignEvent event) {
        double[] features = new double[FEATURE_COUNT];
        AuthAttempt attempt = event.getAttempt();
        ThreatSignal signal = event.getSignal();

        ZonedDateTime time = event.getTimestamp().atZone(ZoneOffset.UTC);
        features[0] = time.getHour();
        features[1] = time.getDayOfWeek().getValue() - 1;

        features[2] = bucket(attempt.getClientIp());
        features[3] = bucket(attempt.getUserAgent());

        features[4] = signal.getIpReputationScore();
        features[5] = signal.getKnownAttackPatterns().size();
        features[6] = signal.getSimilarAttacksDetected();

        GeoLocation geo = attempt.getGeolocation();
        if (geo != null) {
            features[7] = geo.getLatitude();
            features[8] = geo.getLongitude();
        }

        features[9] = attempt.isTor() || attempt.isVpn() ? 1.0 : 0.0;
        return features;
    }

    /**
     * Key for grouping events without clustering: one group per client IP.
     */
    public String groupingKey(CampaignEvent event) {
        String ip = event.clientIp();
        return "ip:" + (ip == null || ip.isBlank() ? "unknown" : ip);
    }

    /**
     * Wrap an attempt and its signal as a campaign event.
     *
     * The event id derives from the attempt's request id when present, so the same
     * attempt submitted twice maps to the same event.
     *
     * @param index position of the attempt in its batch, used when there is no request id
     */
    public CampaignEvent toEvent(AuthAttempt attempt, ThreatSignal signal, int index) {
        Instant timestamp = attempt.getTimestamp() != null ? attempt.getTimestamp() : Instant.EPOCH;
        String eventId = attempt.getRequestId() != null && !attempt.getRequestId().isBlank()
            ? "evt_" + attempt.getRequestId()
            : "event_" + timestamp.getEpochSecond() + "_" + index;
        double score = signal != null ? signal.getIpReputationScore() : 0.0;
        double confidence = Math.max(0.0, Math.min(1.0, score));
        return new CampaignEvent(eventId, timestamp, attempt, signal, confidence);
    }

    private static int bucket(String value) {
        if (value == null) {
            return 0;
        }
        return Math.floorMod(value.hashCode(), HASH_BUCKETS);
    }
}
