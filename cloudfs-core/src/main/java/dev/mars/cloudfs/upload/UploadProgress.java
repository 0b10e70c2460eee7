/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cloudfs.upload;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks bytes sent for one upload and derives a smoothed transfer rate.
 * Safe to read from other threads while the upload runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class UploadProgress {
    private final String sessionId;
    private final long totalBytes;
    private final Clock clock;
    private final AtomicLong sentBytes = new AtomicLong();
    private final AtomicReference<Instant> startTime = new AtomicReference<>();
    private final AtomicReference<Instant> lastRateUpdate = new AtomicReference<>();
    private final AtomicLong bytesAtLastRateUpdate = new AtomicLong();
    private final AtomicReference<Double> currentRate = new AtomicReference<>(0.0);

    public UploadProgress(String sessionId, long totalBytes) {
        this(sessionId, totalBytes, Clock.systemUTC());
    }

    public UploadProgress(String sessionId, long totalBytes, Clock clock) {
        this.sessionId = sessionId;
        this.totalBytes = totalBytes;
        this.clock = clock;
    }

    public void start() {
        Instant now = clock.instant();
        startTime.set(now);
        lastRateUpdate.set(now);
    }

    public void chunkSent(int bytes) {
        long total = sentBytes.addAndGet(bytes);
        updateRate(total, clock.instant());
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getSentBytes() {
        return sentBytes.get();
    }

    public double getFraction() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) sentBytes.get() / totalBytes);
    }

    public double getCurrentRateBytesPerSecond() {
        return currentRate.get();
    }

    /**
     * Average rate since {@link #start()}, in bytes per second.
     */
    public double getAverageRateBytesPerSecond() {
        Instant start = startTime.get();
        if (start == null) {
            return 0.0;
        }
        long elapsedMs = Duration.between(start, clock.instant()).toMillis();
        if (elapsedMs <= 0) {
            return 0.0;
        }
        return (double) sentBytes.get() / elapsedMs * 1000.0;
    }

    private void updateRate(long currentBytes, Instant now) {
        Instant last = lastRateUpdate.get();
        if (last == null) {
            return;
        }

        long elapsedMs = Duration.between(last, now).toMillis();
        long delta = currentBytes - bytesAtLastRateUpdate.get();
        if (elapsedMs <= 0 || delta <= 0) {
            return;
        }

        double instantRate = (double) delta / elapsedMs * 1000.0;
        double previous = currentRate.get();
        // exponential moving average
        currentRate.set(previous == 0.0 ? instantRate : previous * 0.7 + instantRate * 0.3);
        bytesAtLastRateUpdate.set(currentBytes);
        lastRateUpdate.set(now);
    }

    @Override
    public String toString() {
        return String.format("UploadProgress{session='%s', sent=%d/%d (%.1f%%), rate=%.2f MB/s}",
                sessionId, sentBytes.get(), totalBytes, getFraction() * 100,
                getCurrentRateBytesPerSecond() / (1024.0 * 1024.0));
    }
}
