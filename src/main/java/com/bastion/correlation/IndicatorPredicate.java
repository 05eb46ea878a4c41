package com.bastion.correlation;

import com.bastion.domain.CampaignEvent;
import com.bastion.domain.GeoLocation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Named boolean tests evaluated against a whole group of events when scoring
 * attack signatures. Names are the snake_case identifiers used in signature files.
 */
public enum IndicatorPredicate {

    /** Two consecutive attempts less than a minute apart */
    RAPID_ATTEMPTS("rapid_attempts") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            List<Instant> times = sortedTimestamps(events);
            for (int i = 1; i < times.size(); i++) {
                if (Duration.between(times.get(i - 1), times.get(i)).compareTo(RAPID_GAP) < 0) {
                    return true;
                }
            }
            return false;
        }
    },

    MULTIPLE_FAILURES("multiple_failures") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            long failures = events.stream().filter(e -> !e.getAttempt().isLoginSucceeded()).count();
            return failures >= 3;
        }
    },

    SAME_IP("same_ip") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return !events.isEmpty() && distinct(events, CampaignEvent::clientIp) == 1;
        }
    },

    MULTIPLE_IPS("multiple_ips") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return distinct(events, CampaignEvent::clientIp) >= 3;
        }
    },

    COMMON_PASSWORDS("common_passwords") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return events.stream().anyMatch(e -> e.getSignal().getCredentialStuffing().isCommonPasswords()
                || (e.getAttempt().getPasswordHash() != null
                    && e.getAttempt().getPasswordHash().toLowerCase(Locale.ROOT).contains("password")));
        }
    },

    /** At most one in ten attempts succeeded */
    LOW_SUCCESS_RATE("low_success_rate") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            if (events.isEmpty()) {
                return false;
            }
            long succeeded = events.stream().filter(e -> e.getAttempt().isLoginSucceeded()).count();
            return succeeded * 10 <= events.size();
        }
    },

    LOCATION_ANOMALY("location_anomaly") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return events.stream().anyMatch(e -> {
                GeoLocation geo = e.getAttempt().getGeolocation();
                return (geo != null && !geo.isUsualLocation())
                    || e.getSignal().getAccountTakeover().isLocationAnomaly();
            });
        }
    },

    DEVICE_CHANGE("device_change") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return distinct(events, CampaignEvent::userAgent) > 1;
        }
    },

    SUCCESSFUL_LOGIN("successful_login") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return events.stream().anyMatch(e -> e.getAttempt().isLoginSucceeded());
        }
    },

    /** Attempts spread over more than an hour */
    PERSISTENT_ATTEMPTS("persistent_attempts") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            List<Instant> times = sortedTimestamps(events);
            if (times.size() < 2) {
                return false;
            }
            return Duration.between(times.get(0), times.get(times.size() - 1)).compareTo(PERSISTENT_SPAN) > 0;
        }
    },

    SPECIFIC_TARGETS("specific_targets") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return !events.isEmpty() && distinct(events, CampaignEvent::email) <= 3;
        }
    },

    ADVANCED_EVASION("advanced_evasion") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return events.stream().map(CampaignEvent::getAttempt).anyMatch(a -> a.isTor() || a.isVpn());
        }
    },

    DISTRIBUTED_SOURCES("distributed_sources") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            return distinct(events, CampaignEvent::clientIp) >= 5;
        }
    },

    /** Inter-attempt intervals with a coefficient of variation below 0.1 */
    COORDINATED_TIMING("coordinated_timing") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            List<Instant> times = sortedTimestamps(events);
            if (times.size() < 3) {
                return false;
            }
            double[] intervals = new double[times.size() - 1];
            double sum = 0.0;
            for (int i = 1; i < times.size(); i++) {
                intervals[i - 1] = Duration.between(times.get(i - 1), times.get(i)).toMillis() / 1000.0;
                sum += intervals[i - 1];
            }
            double mean = sum / intervals.length;
            if (mean <= 0.0) {
                return false;
            }
            double variance = 0.0;
            for (double interval : intervals) {
                variance += (interval - mean) * (interval - mean);
            }
            variance /= intervals.length;
            return Math.sqrt(variance) / mean < 0.1;
        }
    },

    /** Fewer than half of the attempts bring a user agent of their own */
    SIMILAR_PATTERNS("similar_patterns") {
        @Override
        public boolean test(List<CampaignEvent> events) {
            if (events.isEmpty()) {
                return false;
            }
            return (double) distinct(events, CampaignEvent::userAgent) / events.size() < 0.5;
        }
    };

    static final Duration RAPID_GAP = Duration.ofSeconds(60);
    static final Duration PERSISTENT_SPAN = Duration.ofHours(1);

    private final String name;

    IndicatorPredicate(String name) {
        this.name = name;
    }

    /**
     * Evaluate the predicate against a group of events.
     */
    public abstract boolean test(List<CampaignEvent> events);

    public String getName() {
        return name;
    }

    /**
     * @throws InvalidConfigurationException if no predicate has that name
     */
    public static IndicatorPredicate fromName(String name) {
        for (IndicatorPredicate predicate : values()) {
            if (predicate.name.equalsIgnoreCase(name) || predicate.name().equalsIgnoreCase(name)) {
                return predicate;
            }
        }
        throw new InvalidConfigurationException("Unknown signature indicator: " + name);
    }

    static List<Instant> sortedTimestamps(List<CampaignEvent> events) {
        List<Instant> times = new ArrayList<>(events.size());
        for (CampaignEvent event : events) {
            times.add(event.getTimestamp());
        }
        Collections.sort(times);
        return times;
    }

    static int distinct(List<CampaignEvent> events, Function<CampaignEvent, String> field) {
        Set<String> values = new HashSet<>();
        for (CampaignEvent event : events) {
            values.add(field.apply(event));
        }
        return values.size();
    }
}
