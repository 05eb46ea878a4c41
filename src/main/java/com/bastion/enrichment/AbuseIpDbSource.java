package com.bastion.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AbuseIPDB v2 check endpoint. Confidence is the abuse confidence percentage scaled to [0,1].
 */
public class AbuseIpDbSource extends AbstractHttpReputationSource {

    public static final String NAME = "abuseipdb";
    public static final RequestBudget DEFAULT_BUDGET = RequestBudget.of(1000, Duration.ofDays(1));

    private static final int MAX_AGE_DAYS = 90;

    public AbuseIpDbSource(WebClient webClient, String apiKey, RequestBudget budget) {
        super(NAME, webClient, apiKey, budget);
    }

    @Override
    public double maliciousCutoff() {
        return 0.5;
    }

    @Override
    public double suspiciousCutoff() {
        return 0.2;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String ip) {
        return webClient.get()
            .uri(uri -> uri.path("/api/v2/check")
                .queryParam("ipAddress", ip)
                .queryParam("maxAgeInDays", MAX_AGE_DAYS)
                .build())
            .header("Key", apiKey)
            .accept(MediaType.APPLICATION_JSON);
    }

    @Override
    protected FeedSignal toSignal(String ip, JsonNode body) {
        JsonNode data = body.path("data");
        JsonNode score = data.has("abuseConfidenceScore")
            ? data.path("abuseConfidenceScore")
            : data.path("abuseConfidencePercentage");
        double confidence = score.asDouble(0.0) / 100.0;

        List<String> tags = new ArrayList<>();
        if (data.path("isTor").asBoolean(false)) {
            tags.add("tor");
        }
        String usageType = data.path("usageType").asText("");
        if (!usageType.isEmpty()) {
            tags.add(usageType.toLowerCase(Locale.ROOT));
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("abuseConfidenceScore", score.asInt(0));
        raw.put("totalReports", data.path("totalReports").asInt(0));
        raw.put("countryCode", data.path("countryCode").asText(""));
        raw.put("isp", data.path("isp").asText(""));
        return new FeedSignal(NAME, confidence, tags, raw);
    }
}
