package com.ruralhome.listingtracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "detailExecutor", destroyMethod = "shutdown")
    public ExecutorService detailExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrentDetails());
    }

    @Bean(name = "listingWriterExecutor", destroyMethod = "shutdown")
    public ExecutorService listingWriterExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
