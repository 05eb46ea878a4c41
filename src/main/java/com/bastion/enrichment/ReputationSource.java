package com.bastion.enrichment;

import reactor.core.publisher.Mono;

/**
 * An external IP reputation feed.
 *
 * Implementations perform one non-blocking lookup per call. Rate limiting, caching
 * and timeouts are applied around them by {@link ReputationFeedClient}, so a source
 * only has to translate the feed's response into a {@link FeedSignal}.
 */
public interface ReputationSource {

    /**
     * Stable source name, used in verdict sources and cache keys.
     */
    String name();

    /**
     * How many lookups the feed allows per window.
     */
    RequestBudget budget();

    /**
     * Confidence above which this feed's signal escalates a verdict to malicious.
     */
    double maliciousCutoff();

    /**
     * Confidence above which this feed's signal escalates a verdict to suspicious.
     */
    double suspiciousCutoff();

    /**
     * Look up an IP address.
     *
     * @param ip the address to look up
     * @return Mono with the feed's signal; an IP the feed does not know yields a zero-confidence signal
     */
    Mono<FeedSignal> lookup(String ip);
}
