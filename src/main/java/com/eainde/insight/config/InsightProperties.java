package com.eainde.insight.config;

import com.eainde.insight.model.AggregationPolicy;
import com.eainde.insight.analysis.PlatformProfile;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "insight")
@Data
public class InsightProperties {

    private Oracle oracle = new Oracle();
    private Ingestion ingestion = new Ingestion();
    private Analysis analysis = new Analysis();

    @Data
    public static class Oracle {
        /** OpenAI-compatible base URL of the LLM proxy. */
        private String baseUrl;
        private String apiKey;
        private String modelName = "gemini-2.5-flash";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 1;
        private int schemaMaxTokens = 1024;
        private int narrativeMaxTokens = 400;
        private int sampleRows = 5;
        private boolean logRequests = false;

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Ingestion {
        private AggregationPolicy aggregationPolicy = AggregationPolicy.SINGLE_DAY;
    }

    @Data
    public static class Analysis {
        private int minRecords = PlatformProfile.DEFAULT_MIN_RECORDS;
        private int windowDays = PlatformProfile.DEFAULT_WINDOW_DAYS;
        private int parallelism = 3;
    }
}
