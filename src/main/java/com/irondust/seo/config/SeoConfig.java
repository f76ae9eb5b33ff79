package com.irondust.seo.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.JsonFileKeyValueStore;
import com.irondust.seo.service.cache.KeyValueStore;
import com.irondust.seo.service.retry.Sleeper;
import com.irondust.seo.service.retry.ThreadSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class SeoConfig {
    private static final Logger log = LoggerFactory.getLogger(SeoConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyValueStore keyValueStore(AppProperties appProperties, Clock clock) {
        if ("memory".equalsIgnoreCase(appProperties.getStoreType())) {
            log.info("Using in-memory key-value store");
            return new InMemoryKeyValueStore(clock);
        }
        String path = appProperties.getStorePath() != null ? appProperties.getStorePath() : "tmp/seo-store.json";
        log.info("Using JSON file key-value store at {}", path);
        return new JsonFileKeyValueStore(Path.of(path), clock);
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadSleeper();
    }
}
