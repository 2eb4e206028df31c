package com.phonos.commerce.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Semaphore;

@Configuration
public class RateLimiterConfig {

    @Value("${aws.bedrock.rateLimit:5.0}") // permits per second
    private double bedrockRateLimit;
    @Value("${app.ratelimit.telephonyQps:1.0}")
    private double telephonyQps;
    @Value("${app.calls.max-concurrent:6}")
    private int maxConcurrentCalls;

    @Bean("bedrockRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter bedrockRateLimiter() {
        return RateLimiter.create(Math.max(0.1, bedrockRateLimit));
    }

    @Bean("telephonyRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter telephonyRateLimiter() {
        return createOptionalLimiter(telephonyQps);
    }

    /**
     * Process-wide ceiling on outbound calls in flight, shared by every ticket's batch.
     */
    @Bean("callPermits")
    public Semaphore callPermits() {
        return new Semaphore(Math.max(1, maxConcurrentCalls), true);
    }

    private RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
