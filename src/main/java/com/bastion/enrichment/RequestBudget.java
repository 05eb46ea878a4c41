package com.bastion.enrichment;

import java.time.Duration;

/**
 * Request allowance of an external feed: at most {@code requests} calls per {@code window}.
 */
public final class RequestBudget {

    private final int requests;
    private final Duration window;

    public RequestBudget(int requests, Duration window) {
        if (requests <= 0) {
            throw new IllegalArgumentException("Request budget must be positive: " + requests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Request budget window must be positive: " + window);
        }
        this.requests = requests;
        this.window = window;
    }

    public static RequestBudget of(int requests, Duration window) {
        return new RequestBudget(requests, window);
    }

    public int getRequests() {
        return requests;
    }

    public Duration getWindow() {
        return window;
    }

    @Override
    public String toString() {
        return requests + "/" + window;
    }
}
