package com.bastion.enrichment;

import java.util.List;
import java.util.Map;

/**
 * What one external reputation feed reported about an IP.
 */
public final class FeedSignal {

    private final String source;
    private final double maliciousConfidence;
    private final List<String> tags;
    private final Map<String, Object> raw;

    public FeedSignal(String source, double maliciousConfidence, List<String> tags, Map<String, Object> raw) {
        this.source = source;
        this.maliciousConfidence = Math.max(0.0, Math.min(1.0, maliciousConfidence));
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.raw = raw != null ? Map.copyOf(raw) : Map.of();
    }

    /**
     * Signal for an IP the feed does not list.
     */
    public static FeedSignal notListed(String source) {
        return new FeedSignal(source, 0.0, List.of(), Map.of());
    }

    public String getSource() {
        return source;
    }

    /**
     * Fraction in [0,1] expressing how strongly the feed believes the IP is malicious
     */
    public double getMaliciousConfidence() {
        return maliciousConfidence;
    }

    public List<String> getTags() {
        return tags;
    }

    public Map<String, Object> getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return "FeedSignal{" + source + ", confidence=" + maliciousConfidence + ", tags=" + tags + "}";
    }
}
