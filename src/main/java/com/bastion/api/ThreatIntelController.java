package com.bastion.api;

import com.bastion.correlation.CampaignEngine;
import com.bastion.domain.AttackCampaign;
import com.bastion.domain.CampaignStatistics;
import com.bastion.domain.CampaignType;
import com.bastion.domain.IndicatorKind;
import com.bastion.domain.IndicatorStatistics;
import com.bastion.domain.ReputationLevel;
import com.bastion.domain.ReputationVerdict;
import com.bastion.domain.ThreatIndicator;
import com.bastion.enrichment.ReputationAnalyzer;
import com.bastion.storage.CampaignStore;
import com.bastion.storage.IndicatorStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only query API over campaigns, indicators and IP reputation for
 * dashboards and other observability consumers.
 *
 * Note: authn/authz is expected to be enforced by upstream security layers.
 */
@RestController
@RequestMapping("/api")
public class ThreatIntelController {

    private final CampaignStore campaignStore;
    private final CampaignEngine campaignEngine;
    private final IndicatorStore indicatorStore;
    private final ReputationAnalyzer reputationAnalyzer;

    public ThreatIntelController(CampaignStore campaignStore,
                                 CampaignEngine campaignEngine,
                                 IndicatorStore indicatorStore,
                                 ReputationAnalyzer reputationAnalyzer) {
        this.campaignStore = campaignStore;
        this.campaignEngine = campaignEngine;
        this.indicatorStore = indicatorStore;
        this.reputationAnalyzer = reputationAnalyzer;
    }

    /**
     * Campaigns filtered by one of source IP, target user or campaign type; all campaigns without a filter.
     */
    @GetMapping("/campaigns")
    public List<AttackCampaign> findCampaigns(@RequestParam(required = false) String ip,
                                              @RequestParam(required = false) String user,
                                              @RequestParam(required = false) String type) {
        if (ip != null) {
            return campaignStore.findByIp(ip);
        }
        if (user != null) {
            return campaignStore.findByUser(user);
        }
        if (type != null) {
            return campaignStore.findByType(CampaignType.fromValue(type));
        }
        return campaignStore.all();
    }

    @GetMapping("/campaigns/recent")
    public List<AttackCampaign> recentCampaigns(@RequestParam(defaultValue = "24") long hours) {
        return campaignStore.findRecent(hours);
    }

    @GetMapping("/campaigns/statistics")
    public CampaignStatistics campaignStatistics() {
        return campaignEngine.statistics();
    }

    @GetMapping("/campaigns/{campaignId}")
    public ResponseEntity<AttackCampaign> getCampaign(@PathVariable String campaignId) {
        return campaignStore.get(campaignId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/indicators")
    public ResponseEntity<List<ThreatIndicator>> searchIndicators(@RequestParam(required = false) String kind,
                                                                  @RequestParam(required = false) String level,
                                                                  @RequestParam(required = false) List<String> tag) {
        IndicatorKind indicatorKind;
        ReputationLevel reputationLevel;
        try {
            indicatorKind = kind != null ? IndicatorKind.fromValue(kind) : null;
            reputationLevel = level != null ? ReputationLevel.fromValue(level) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(indicatorStore.search(indicatorKind, reputationLevel, tag));
    }

    @GetMapping("/indicators/statistics")
    public IndicatorStatistics indicatorStatistics() {
        return indicatorStore.statistics();
    }

    @GetMapping("/reputation/{ip}")
    public ReputationVerdict reputation(@PathVariable String ip) {
        return reputationAnalyzer.analyzeIP(ip);
    }
}
