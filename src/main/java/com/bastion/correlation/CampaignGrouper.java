package com.bastion.correlation;

import com.bastion.domain.CampaignEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a batch of events into candidate campaign groups.
 *
 * Batches smaller than the clustering minimum, and batches for which clustering
 * fails, are grouped by client IP. Otherwise events are density-clustered over
 * their feature vectors and noise points are dropped.
 */
public class CampaignGrouper {

    private static final Logger log = LoggerFactory.getLogger(CampaignGrouper.class);

    private final EventFeaturizer featurizer;
    private final DensityClusterer clusterer;
    private final CampaignMetrics metrics;

    public CampaignGrouper(EventFeaturizer featurizer, DensityClusterer clusterer, CampaignMetrics metrics) {
        this.featurizer = featurizer;
        this.clusterer = clusterer;
        this.metrics = metrics;
    }

    /**
     * @return groups keyed "cluster_N" or "ip:ADDRESS", in order of first appearance
     */
    public Map<String, List<CampaignEvent>> group(List<CampaignEvent> events) {
        if (events.isEmpty()) {
            return new LinkedHashMap<>();
        }
        if (events.size() < clusterer.getMinSamples()) {
            return groupHeuristically(events);
        }
        try {
            return groupByClusters(events);
        } catch (RuntimeException e) {
            log.warn("Clustering failed for {} events, grouping by client IP instead: {}", events.size(), e.getMessage());
            metrics.recordClusteringFallback();
            return groupHeuristically(events);
        }
    }

    private Map<String, List<CampaignEvent>> groupByClusters(List<CampaignEvent> events) {
        double[][] features = new double[events.size()][];
        for (int i = 0; i < events.size(); i++) {
            features[i] = featurizer.featurize(events.get(i));
        }

        int[] labels = clusterer.cluster(features);
        Map<String, List<CampaignEvent>> groups = new LinkedHashMap<>();
        int noise = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == DensityClusterer.NOISE) {
                noise++;
                continue;
            }
            groups.computeIfAbsent("cluster_" + labels[i], k -> new ArrayList<>()).add(events.get(i));
        }
        log.debug("Clustered {} events into {} groups, {} noise points", events.size(), groups.size(), noise);
        return groups;
    }

    Map<String, List<CampaignEvent>> groupHeuristically(List<CampaignEvent> events) {
        Map<String, List<CampaignEvent>> groups = new LinkedHashMap<>();
        for (CampaignEvent event : events) {
            groups.computeIfAbsent(featurizer.groupingKey(event), k -> new ArrayList<>()).add(event);
        }
        return groups;
    }
}
