package com.patentintel.status.config;

import com.patentintel.status.cache.PatentCacheStore;
import com.patentintel.status.service.PatentLookupService;
import com.patentintel.status.service.TierRateLimiter;
import com.patentintel.status.source.FetchResult;
import com.patentintel.status.source.SourceAdapter;
import com.patentintel.status.source.SourceRouter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the lookup core with immutable values read once from {@link PatentStatusProperties}.
 */
@Configuration
public class LookupConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, PatentStatusProperties properties) {
        return builder
                .setConnectTimeout(properties.getHttp().getConnectTimeout())
                .setReadTimeout(properties.getHttp().getReadTimeout())
                .build();
    }

    @Bean
    public SourceRouter sourceRouter(PatentStatusProperties properties, List<SourceAdapter> adapters) {
        return new SourceRouter(properties.getRouting(), adapters);
    }

    /** One retry on a transient failure of a cache miss, after a fixed backoff. */
    @Bean
    public Retry upstreamMissRetry(PatentStatusProperties properties) {
        return missRetry(properties.getLookup().getRetryBackoff());
    }

    @Bean
    public PatentLookupService patentLookupService(PatentCacheStore cacheStore, SourceRouter router,
                                                   Retry upstreamMissRetry, Clock clock,
                                                   PatentStatusProperties properties) {
        return new PatentLookupService(cacheStore, router, upstreamMissRetry, clock,
                properties.getCache().getTtl());
    }

    @Bean
    public TierRateLimiter tierRateLimiter(PatentStatusProperties properties, Clock clock) {
        return new TierRateLimiter(properties.getRateLimit().getLimits(), clock);
    }

    public static Retry missRetry(Duration backoff) {
        RetryConfig config = RetryConfig.<FetchResult>custom()
                .maxAttempts(2)
                .waitDuration(backoff)
                .retryOnResult(FetchResult::isTransient)
                .retryOnException(e -> false)
                .build();
        return Retry.of("upstream-miss", config);
    }
}
