package com.archivist.taxonomy.config;

import com.archivist.taxonomy.infra.BucketRateLimiter;
import com.archivist.taxonomy.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(@Value("${app.gemini.chat-rpm:12}") int rpm) {
        return new BucketRateLimiter(rpm);
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(PipelineProperties properties,
                                        @Value("${app.gemini.embedding-texts-per-minute:15000}") long textsPerMinute) {
        return new BucketRateLimiter(properties.embedding().requestsPerMinute(), textsPerMinute);
    }
}
