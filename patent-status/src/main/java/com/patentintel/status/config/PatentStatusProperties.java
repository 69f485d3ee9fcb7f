package com.patentintel.status.config;

import com.patentintel.status.model.PatentSource;
import com.patentintel.status.model.Tier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "patent-status")
@Data
public class PatentStatusProperties {

    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Lookup lookup = new Lookup();
    private Map<String, PatentSource> routing = defaultRouting();
    private Epo epo = new Epo();
    private Uspto uspto = new Uspto();
    private Http http = new Http();
    private UsageLog usageLog = new UsageLog();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofDays(30);
        private boolean refreshEnabled = true;
        private int refreshTopN = 100;
        private String refreshCron = "0 0 3 * * *";
    }

    @Data
    public static class RateLimit {
        // ENTERPRISE is contractual and never enforced here
        private Map<Tier, Integer> limits = defaultLimits();
    }

    @Data
    public static class Lookup {
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Epo {
        private String baseUrl = "https://ops.epo.org/3.2";
        private String consumerKey = "";
        private String consumerSecret = "";
        private Duration tokenTtl = Duration.ofMinutes(15);
    }

    @Data
    public static class Uspto {
        private String baseUrl = "https://developer.uspto.gov/ds-api";
        private String apiKey = "";
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class UsageLog {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/usage";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    private static Map<String, PatentSource> defaultRouting() {
        Map<String, PatentSource> routing = new LinkedHashMap<>();
        routing.put("EP", PatentSource.EPO);
        routing.put("US", PatentSource.USPTO);
        return routing;
    }

    private static Map<Tier, Integer> defaultLimits() {
        Map<Tier, Integer> limits = new EnumMap<>(Tier.class);
        limits.put(Tier.FREE, 20);
        limits.put(Tier.STARTER, 1000);
        limits.put(Tier.PRO, 10000);
        return limits;
    }
}
