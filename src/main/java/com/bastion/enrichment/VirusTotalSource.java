package com.bastion.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VirusTotal v3 IP address report. Confidence is the share of engines flagging the IP as malicious.
 */
public class VirusTotalSource extends AbstractHttpReputationSource {

    public static final String NAME = "virustotal";
    public static final RequestBudget DEFAULT_BUDGET = RequestBudget.of(4, Duration.ofMinutes(1));

    public VirusTotalSource(WebClient webClient, String apiKey, RequestBudget budget) {
        super(NAME, webClient, apiKey, budget);
    }

    @Override
    public double maliciousCutoff() {
        return 0.3;
    }

    @Override
    public double suspiciousCutoff() {
        return 0.1;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String ip) {
        return webClient.get()
            .uri("/api/v3/ip_addresses/{ip}", ip)
            .header("x-apikey", apiKey)
            .accept(MediaType.APPLICATION_JSON);
    }

    @Override
    protected FeedSignal toSignal(String ip, JsonNode body) {
        JsonNode attributes = body.path("data").path("attributes");
        if (attributes.isMissingNode()) {
            attributes = body.path("attributes");
        }
        JsonNode stats = attributes.path("last_analysis_stats");

        long total = 0;
        Map<String, Object> counts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = stats.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            long count = field.getValue().asLong(0);
            counts.put(field.getKey(), count);
            total += count;
        }
        long malicious = stats.path("malicious").asLong(0);
        double confidence = total > 0 ? (double) malicious / total : 0.0;

        List<String> tags = new ArrayList<>();
        for (JsonNode tag : attributes.path("tags")) {
            tags.add(tag.asText());
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("last_analysis_stats", counts);
        raw.put("reputation", attributes.path("reputation").asInt(0));
        return new FeedSignal(NAME, confidence, tags, raw);
    }
}
