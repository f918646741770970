package com.archivist.taxonomy.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class BucketRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> weightBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final long weightPerMinute;

    public BucketRateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, 0);
    }

    public BucketRateLimiter(int requestsPerMinute, long weightPerMinute) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.weightPerMinute = weightPerMinute;
    }

    private static Bucket perMinute(long capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        requests.asBlocking().consume(1);

        if (weightPerMinute > 0 && permits > 0) {
            Bucket weight = weightBuckets.computeIfAbsent(key, k -> perMinute(weightPerMinute));
            long cost = Math.min(permits, weightPerMinute);
            if (cost < permits) {
                log.warn("Call cost {} for '{}' exceeds the per-minute budget {}, clamping", permits, key, weightPerMinute);
            }
            weight.asBlocking().consume(cost);
        }
    }

    public long availableRequests(String key) {
        return requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute)).getAvailableTokens();
    }
}
