package com.bastion.storage;

import com.bastion.domain.AttackCampaign;
import com.bastion.domain.CampaignEvent;
import com.bastion.domain.CampaignStatistics;
import com.bastion.domain.CampaignType;
import com.bastion.domain.ThreatActor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Durable home of attack campaigns with secondary indexes by source IP, target
 * user, campaign type and threat actor.
 *
 * Index keys are prefixed ("ip:", "user:", "type:", "actor:") and always reflect the
 * current campaign contents: every mutation that can change a campaign's sets goes
 * through this store and re-indexes under the write lock.
 */
public class CampaignStore {

    private static final Logger log = LoggerFactory.getLogger(CampaignStore.class);

    private final Map<String, AttackCampaign> campaigns = new LinkedHashMap<>();
    private final Map<String, Set<String>> index = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SnapshotFile<AttackCampaign> snapshot;
    private final Clock clock;

    public CampaignStore(SnapshotFile<AttackCampaign> snapshot, Clock clock) {
        this.snapshot = snapshot;
        this.clock = clock;
        loadFromFile();
    }

    public CampaignStore(Clock clock) {
        this(null, clock);
    }

    /**
     * Insert a campaign, or replace the stored campaign with the same id.
     */
    public void add(AttackCampaign campaign) {
        if (campaign == null || campaign.getCampaignId() == null) {
            throw new IllegalArgumentException("Campaign and campaign id must not be null");
        }
        lock.writeLock().lock();
        try {
            AttackCampaign previous = campaigns.put(campaign.getCampaignId(), campaign);
            if (previous != null) {
                unindex(previous);
            }
            indexCampaign(campaign);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AttackCampaign> get(String campaignId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(campaigns.get(campaignId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String campaignId) {
        lock.readLock().lock();
        try {
            return campaigns.containsKey(campaignId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Append an event to a stored campaign and refresh its index entries.
     *
     * @return true if the event was appended, false if the campaign is unknown or
     *         already holds an event with the same id
     */
    public boolean addEvent(String campaignId, CampaignEvent event) {
        lock.writeLock().lock();
        try {
            AttackCampaign campaign = campaigns.get(campaignId);
            if (campaign == null) {
                log.warn("Cannot add event {} to unknown campaign {}", event.getEventId(), campaignId);
                return false;
            }
            boolean added = campaign.addEvent(event);
            if (added) {
                indexCampaign(campaign);
            }
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply a bookkeeping change (related campaigns, IOCs) to a stored campaign
     * under the write lock. Changes to type or actor are re-indexed.
     */
    public boolean mutate(String campaignId, Consumer<AttackCampaign> change) {
        lock.writeLock().lock();
        try {
            AttackCampaign campaign = campaigns.get(campaignId);
            if (campaign == null) {
                return false;
            }
            unindex(campaign);
            try {
                change.accept(campaign);
            } finally {
                indexCampaign(campaign);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<AttackCampaign> findByIp(String ip) {
        return lookup("ip:" + ip);
    }

    public List<AttackCampaign> findByUser(String email) {
        return lookup("user:" + email);
    }

    public List<AttackCampaign> findByType(CampaignType type) {
        return lookup("type:" + type.getValue());
    }

    public List<AttackCampaign> findByActor(ThreatActor actor) {
        return lookup("actor:" + actor.getValue());
    }

    /**
     * Campaigns whose lastSeen falls within the given number of hours before now.
     */
    public List<AttackCampaign> findRecent(long hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        lock.readLock().lock();
        try {
            return campaigns.values().stream()
                .filter(c -> c.getLastSeen() != null && !c.getLastSeen().isBefore(cutoff))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AttackCampaign> all() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(campaigns.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return campaigns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CampaignStatistics statistics(long activeWindowHours) {
        Instant activeCutoff = clock.instant().minus(Duration.ofHours(activeWindowHours));
        lock.readLock().lock();
        try {
            int active = 0;
            long totalEvents = 0;
            long totalDurationSeconds = 0;
            Map<String, Long> types = new HashMap<>();
            Map<String, Long> actors = new HashMap<>();

            for (AttackCampaign campaign : campaigns.values()) {
                if (campaign.getLastSeen() != null && !campaign.getLastSeen().isBefore(activeCutoff)) {
                    active++;
                }
                totalEvents += campaign.getEvents().size();
                totalDurationSeconds += campaign.getDuration().getSeconds();
                types.merge(campaign.getCampaignType().getValue(), 1L, Long::sum);
                if (campaign.getThreatActor() != null) {
                    actors.merge(campaign.getThreatActor().getValue(), 1L, Long::sum);
                }
            }

            double averageDuration = campaigns.isEmpty() ? 0.0 : (double) totalDurationSeconds / campaigns.size();
            return new CampaignStatistics(campaigns.size(), active, types, actors, averageDuration, totalEvents);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<AttackCampaign> lookup(String key) {
        lock.readLock().lock();
        try {
            Set<String> ids = index.getOrDefault(key, Collections.emptySet());
            List<AttackCampaign> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                AttackCampaign campaign = campaigns.get(id);
                if (campaign != null) {
                    result.add(campaign);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void indexCampaign(AttackCampaign campaign) {
        for (String key : indexKeys(campaign)) {
            index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(campaign.getCampaignId());
        }
    }

    private void unindex(AttackCampaign campaign) {
        for (String key : indexKeys(campaign)) {
            Set<String> ids = index.get(key);
            if (ids != null) {
                ids.remove(campaign.getCampaignId());
                if (ids.isEmpty()) {
                    index.remove(key);
                }
            }
        }
    }

    private static List<String> indexKeys(AttackCampaign campaign) {
        List<String> keys = new ArrayList<>();
        campaign.getSourceIps().forEach(ip -> keys.add("ip:" + ip));
        campaign.getTargetUsers().forEach(user -> keys.add("user:" + user));
        keys.add("type:" + campaign.getCampaignType().getValue());
        if (campaign.getThreatActor() != null) {
            keys.add("actor:" + campaign.getThreatActor().getValue());
        }
        return keys;
    }

    private void loadFromFile() {
        if (snapshot == null) {
            return;
        }
        Collection<AttackCampaign> loaded = snapshot.read();
        lock.writeLock().lock();
        try {
            for (AttackCampaign campaign : loaded) {
                if (campaign.getCampaignId() == null) {
                    log.warn("Skipping persisted campaign without id");
                    continue;
                }
                campaign.rebuildDerivedState();
                campaigns.put(campaign.getCampaignId(), campaign);
                indexCampaign(campaign);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} campaigns from {}", campaigns.size(), snapshot.getPath());
    }

    /**
     * Write every campaign to the snapshot file. Failures are logged, not thrown.
     */
    public void saveToFile() {
        if (snapshot == null) {
            return;
        }
        List<AttackCampaign> copy = all();
        try {
            lock.readLock().lock();
            try {
                snapshot.write(copy);
            } finally {
                lock.readLock().unlock();
            }
            log.info("Saved {} campaigns to {}", copy.size(), snapshot.getPath());
        } catch (IOException e) {
            log.error("Could not save campaigns to {}", snapshot.getPath(), e);
        }
    }
}
