package io.clusternavigator.dns;

import io.clusternavigator.models.DnsStats;

/**
 * Process-wide DNS resolution counters. All access is synchronized on the instance.
 */
public class DnsStatistics {

    private long requestCount;
    private long successCount;
    private long failureCount;
    private double totalTimeSeconds;

    public synchronized void record(boolean success, double elapsedSeconds) {
        requestCount++;
        if (success) {
            successCount++;
        } else {
            failureCount++;
        }
        totalTimeSeconds += elapsedSeconds;
    }

    public synchronized DnsStats snapshot() {
        double average = requestCount > 0 ? totalTimeSeconds / requestCount : 0.0;
        return new DnsStats(requestCount, successCount, failureCount, totalTimeSeconds, average);
    }

    public synchronized void reset() {
        requestCount = 0;
        successCount = 0;
        failureCount = 0;
        totalTimeSeconds = 0.0;
    }
}
