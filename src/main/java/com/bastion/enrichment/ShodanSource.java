package com.bastion.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shodan host lookup. Shodan describes exposure, not reputation, so its signal
 * carries context (ports, hostnames, organisation, country) and never escalates a verdict.
 */
public class ShodanSource extends AbstractHttpReputationSource {

    public static final String NAME = "shodan";
    public static final RequestBudget DEFAULT_BUDGET = RequestBudget.of(100, Duration.ofDays(30));

    public ShodanSource(WebClient webClient, String apiKey, RequestBudget budget) {
        super(NAME, webClient, apiKey, budget);
    }

    // Cutoffs above 1.0 are never exceeded
    @Override
    public double maliciousCutoff() {
        return 1.1;
    }

    @Override
    public double suspiciousCutoff() {
        return 1.1;
    }

    @Override
    protected WebClient.RequestHeadersSpec<?> request(String ip) {
        return webClient.get()
            .uri(uri -> uri.path("/shodan/host/{ip}").queryParam("key", apiKey).build(ip))
            .accept(MediaType.APPLICATION_JSON);
    }

    @Override
    protected FeedSignal toSignal(String ip, JsonNode body) {
        List<Integer> ports = new ArrayList<>();
        for (JsonNode port : body.path("ports")) {
            ports.add(port.asInt());
        }
        List<String> hostnames = new ArrayList<>();
        for (JsonNode hostname : body.path("hostnames")) {
            hostnames.add(hostname.asText());
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("ports", ports);
        raw.put("hostnames", hostnames);
        raw.put("org", body.path("org").asText(""));
        raw.put("country_code", body.path("country_code").asText(""));
        return new FeedSignal(NAME, 0.0, List.of(), raw);
    }
}
