package com.bastion.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Base class for reputation feeds reached over HTTP with Spring's WebClient.
 *
 * Each source owns a circuit breaker so a failing feed stops receiving traffic
 * for a while. A 404 means the feed has no record of the IP and is reported as a
 * zero-confidence signal rather than a failure. Every other error propagates to
 * the caller, which treats the source as unavailable for that lookup.
 */
public abstract class AbstractHttpReputationSource implements ReputationSource {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpReputationSource.class);

    protected final WebClient webClient;
    protected final String apiKey;

    private final String name;
    private final RequestBudget budget;
    private final CircuitBreaker circuitBreaker;

    protected AbstractHttpReputationSource(String name, WebClient webClient, String apiKey, RequestBudget budget) {
        this.name = name;
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.budget = budget;

        // Open at 50% failures over the last 10 calls, retry after 60s
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();
        this.circuitBreaker = CircuitBreaker.of(name + "Feed", cbConfig);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RequestBudget budget() {
        return budget;
    }

    @Override
    public Mono<FeedSignal> lookup(String ip) {
        return request(ip)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(body -> toSignal(ip, body))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.debug("{} has no record of {}", name, ip);
                return Mono.just(FeedSignal.notListed(name));
            })
            .defaultIfEmpty(FeedSignal.notListed(name))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .doOnError(e -> log.warn("{} lookup failed for {}: {}", name, ip, e.getMessage()));
    }

    /**
     * Build the lookup request for the IP.
     */
    protected abstract WebClient.RequestHeadersSpec<?> request(String ip);

    /**
     * Translate the feed's JSON response body into a signal.
     */
    protected abstract FeedSignal toSignal(String ip, JsonNode body);

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
