package com.openrangelabs.donpetre.mlssync.model;

import java.time.LocalDateTime;

/**
 * Rate limit state of a provider as last reported by its response headers
 */
public class RateLimitStatus {

    private final String providerId;
    private final int limit;
    private final int remaining;
    private final LocalDateTime resetTime;

    public RateLimitStatus(String providerId, int limit, int remaining, LocalDateTime resetTime) {
        this.providerId = providerId;
        this.limit = limit;
        this.remaining = remaining;
        this.resetTime = resetTime;
    }

    /**
     * Budget before any response has been seen.
     */
    public static RateLimitStatus unknown(String providerId, int limit, LocalDateTime now) {
        return new RateLimitStatus(providerId, limit, limit, now.plusSeconds(60));
    }

    public RateLimitStatus withRemaining(int newRemaining, LocalDateTime newResetTime) {
        return new RateLimitStatus(providerId, limit, newRemaining, newResetTime != null ? newResetTime : resetTime);
    }

    public boolean isNearLimit(double threshold) {
        return limit > 0 && (double) remaining / limit <= threshold;
    }

    public boolean isExceeded() {
        return remaining <= 0;
    }

    // Getters
    public String getProviderId() { return providerId; }
    public int getLimit() { return limit; }
    public int getRemaining() { return remaining; }
    public LocalDateTime getResetTime() { return resetTime; }

    @Override
    public String toString() {
        return "RateLimitStatus{" +
                "providerId='" + providerId + '\'' +
                ", limit=" + limit +
                ", remaining=" + remaining +
                ", resetTime=" + resetTime +
                '}';
    }
}
