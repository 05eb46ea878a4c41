package com.bastion.storage;

import com.bastion.domain.IndicatorKind;
import com.bastion.domain.IndicatorStatistics;
import com.bastion.domain.ReputationLevel;
import com.bastion.domain.ThreatIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory threat indicator store with CIDR-aware IP matching and file persistence.
 *
 * Indicators are keyed by kind and value; inserting the same key again overwrites.
 * CIDR indicators are additionally kept in a linear network list for containment
 * checks. Expired indicators are skipped by every read path and removed either
 * lazily on exact lookup or by the expiry sweep, which runs hourly on a timer and
 * opportunistically from the insert path.
 *
 * A single reader/writer lock guards all state: lookups and searches share the
 * read lock, inserts and sweeps take the write lock.
 */
public class IndicatorStore {

    private static final Logger log = LoggerFactory.getLogger(IndicatorStore.class);

    private static final Duration SWEEP_INTERVAL = Duration.ofHours(1);

    private final Map<String, ThreatIndicator> indicators = new LinkedHashMap<>();
    private final List<NetworkEntry> networks = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SnapshotFile<ThreatIndicator> snapshot;
    private final Clock clock;

    private Instant lastSweep;

    /**
     * @param snapshot persistence file, or null for a purely in-memory store
     * @param clock clock used for expiry decisions
     */
    public IndicatorStore(SnapshotFile<ThreatIndicator> snapshot, Clock clock) {
        this.snapshot = snapshot;
        this.clock = clock;
        this.lastSweep = clock.instant();
        loadFromFile();
    }

    public IndicatorStore(Clock clock) {
        this(null, clock);
    }

    /**
     * Install the built-in indicators (known scanner user agent, tor exit pattern)
     * unless an indicator with the same key is already present.
     */
    public void seedDefaults() {
        Instant now = clock.instant();
        List<ThreatIndicator> defaults = List.of(
            ThreatIndicator.builder()
                .kind(IndicatorKind.USER_AGENT)
                .value("sqlmap")
                .reputationLevel(ReputationLevel.MALICIOUS)
                .source(ThreatIndicator.SOURCE_INTERNAL)
                .confidence(0.95)
                .tags(List.of("sql_injection", "scanner"))
                .description("SQL injection tool")
                .firstSeen(now)
                .build(),
            ThreatIndicator.builder()
                .kind(IndicatorKind.PATTERN)
                .value("tor_exit_node")
                .reputationLevel(ReputationLevel.SUSPICIOUS)
                .source(ThreatIndicator.SOURCE_INTERNAL)
                .confidence(0.8)
                .tags(List.of("anonymization", "tor"))
                .description("Tor exit node pattern")
                .firstSeen(now)
                .build());

        lock.writeLock().lock();
        try {
            for (ThreatIndicator indicator : defaults) {
                indicators.putIfAbsent(indicator.getKey(), indicator);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Insert or overwrite an indicator.
     */
    public void add(ThreatIndicator indicator) {
        Objects.requireNonNull(indicator, "Indicator must not be null");
        if (indicator.getKind() == null || indicator.getValue() == null) {
            throw new IllegalArgumentException("Indicator kind and value must not be null");
        }

        lock.writeLock().lock();
        try {
            put(indicator);
            maybeSweep();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addAll(Collection<ThreatIndicator> batch) {
        lock.writeLock().lock();
        try {
            for (ThreatIndicator indicator : batch) {
                if (indicator.getKind() == null || indicator.getValue() == null) {
                    log.warn("Ignoring indicator without kind or value: {}", indicator);
                    continue;
                }
                put(indicator);
            }
            maybeSweep();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void put(ThreatIndicator indicator) {
        indicators.put(indicator.getKey(), indicator);

        if (indicator.getKind() == IndicatorKind.CIDR) {
            networks.removeIf(entry -> entry.indicator.getValue().equals(indicator.getValue()));
            Optional<CidrBlock> block = CidrBlock.parse(indicator.getValue());
            if (block.isPresent()) {
                networks.add(new NetworkEntry(block.get(), indicator));
            } else {
                log.warn("Stored CIDR indicator with unparsable network: {}", indicator.getValue());
            }
        }
    }

    /**
     * Exact lookup. An expired hit is removed and reported as absent.
     */
    public Optional<ThreatIndicator> get(IndicatorKind kind, String value) {
        String key = ThreatIndicator.key(kind, value);
        Instant now = clock.instant();

        ThreatIndicator found;
        lock.readLock().lock();
        try {
            found = indicators.get(key);
            if (found == null) {
                return Optional.empty();
            }
            if (!found.isExpired(now)) {
                return Optional.of(found);
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            ThreatIndicator current = indicators.get(key);
            if (current != null && current.isExpired(now)) {
                remove(key, current);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return Optional.empty();
    }

    /**
     * Every unexpired indicator matching the IP: the exact IP indicator plus all
     * network blocks containing it. Malformed input yields an empty list.
     */
    public List<ThreatIndicator> matchIP(String ip) {
        if (CidrBlock.parseAddress(ip).isEmpty()) {
            return List.of();
        }
        String normalized = ip.trim();
        Instant now = clock.instant();
        List<ThreatIndicator> matches = new ArrayList<>();

        lock.readLock().lock();
        try {
            ThreatIndicator exact = indicators.get(ThreatIndicator.key(IndicatorKind.IP, normalized));
            if (exact != null && !exact.isExpired(now)) {
                matches.add(exact);
            }
            for (NetworkEntry entry : networks) {
                if (!entry.indicator.isExpired(now) && entry.block.contains(normalized)) {
                    matches.add(entry.indicator);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return matches;
    }

    /**
     * User-agent and pattern indicators whose value occurs in the given user agent,
     * compared case-insensitively.
     */
    public List<ThreatIndicator> matchUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return List.of();
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        lock.readLock().lock();
        try {
            return indicators.values().stream()
                .filter(i -> i.getKind() == IndicatorKind.USER_AGENT || i.getKind() == IndicatorKind.PATTERN)
                .filter(i -> !i.isExpired(now))
                .filter(i -> ua.contains(i.getValue().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Linear search skipping expired indicators. Null criteria match everything;
     * tags match when the indicator carries any of them.
     */
    public List<ThreatIndicator> search(IndicatorKind kind, ReputationLevel level, Collection<String> tags) {
        Instant now = clock.instant();

        lock.readLock().lock();
        try {
            List<ThreatIndicator> results = new ArrayList<>();
            for (ThreatIndicator indicator : indicators.values()) {
                if (indicator.isExpired(now)) {
                    continue;
                }
                if (kind != null && indicator.getKind() != kind) {
                    continue;
                }
                if (level != null && indicator.getReputationLevel() != level) {
                    continue;
                }
                if (tags != null && !tags.isEmpty() && tags.stream().noneMatch(indicator.getTags()::contains)) {
                    continue;
                }
                results.add(indicator);
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every expired indicator from the map and the network list.
     * Runs hourly; also safe to call from the insert path since the write lock is reentrant.
     *
     * @return number of indicators removed
     */
    @Scheduled(fixedDelayString = "${bastion.storage.indicator-sweep-ms:3600000}",
               initialDelayString = "${bastion.storage.indicator-sweep-ms:3600000}")
    public int cleanupExpired() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<Map.Entry<String, ThreatIndicator>> it = indicators.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            networks.removeIf(entry -> entry.indicator.isExpired(now));
            lastSweep = now;
            if (removed > 0) {
                log.info("Cleaned up {} expired threat indicators", removed);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void maybeSweep() {
        if (Duration.between(lastSweep, clock.instant()).compareTo(SWEEP_INTERVAL) > 0) {
            cleanupExpired();
        }
    }

    private void remove(String key, ThreatIndicator indicator) {
        indicators.remove(key);
        if (indicator.getKind() == IndicatorKind.CIDR) {
            networks.removeIf(entry -> entry.indicator == indicator);
        }
    }

    public IndicatorStatistics statistics() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<ThreatIndicator> live = indicators.values().stream()
                .filter(i -> !i.isExpired(now))
                .collect(Collectors.toList());
            return new IndicatorStatistics(
                live.size(),
                countBy(live, i -> i.getKind().getValue()),
                countBy(live, i -> i.getReputationLevel().getValue()),
                countBy(live, i -> String.valueOf(i.getSource())));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Map<String, Long> countBy(List<ThreatIndicator> items, Function<ThreatIndicator, String> key) {
        Map<String, Long> counts = new HashMap<>();
        for (ThreatIndicator item : items) {
            counts.merge(key.apply(item), 1L, Long::sum);
        }
        return counts;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return indicators.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void loadFromFile() {
        if (snapshot == null) {
            return;
        }
        Instant now = clock.instant();
        List<ThreatIndicator> loaded = snapshot.read();
        lock.writeLock().lock();
        try {
            for (ThreatIndicator indicator : loaded) {
                if (indicator.getKind() != null && indicator.getValue() != null && !indicator.isExpired(now)) {
                    put(indicator);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} threat indicators from {}", indicators.size(), snapshot.getPath());
    }

    /**
     * Write every stored indicator to the snapshot file. Failures are logged, not thrown.
     */
    public void saveToFile() {
        if (snapshot == null) {
            return;
        }
        List<ThreatIndicator> copy;
        lock.readLock().lock();
        try {
            copy = new ArrayList<>(indicators.values());
        } finally {
            lock.readLock().unlock();
        }
        try {
            snapshot.write(copy);
            log.info("Saved {} threat indicators to {}", copy.size(), snapshot.getPath());
        } catch (IOException e) {
            log.error("Could not save threat indicators to {}", snapshot.getPath(), e);
        }
    }

    private static final class NetworkEntry {
        private final CidrBlock block;
        private final ThreatIndicator indicator;

        private NetworkEntry(CidrBlock block, ThreatIndicator indicator) {
            this.block = block;
            this.indicator = indicator;
        }
    }
}
