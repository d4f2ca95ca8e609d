package com.mocha.supporters.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mocha.supporters.sync.classify.Blocklist;
import com.mocha.supporters.sync.classify.BlocklistLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SupportersConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "assetExecutor", destroyMethod = "shutdown")
    public ExecutorService assetExecutor(SupportersProperties properties) {
        int maxConcurrency = properties.getAssets().getMaxConcurrency();
        if (maxConcurrency > 0) {
            return Executors.newFixedThreadPool(maxConcurrency);
        }
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Blocklist blocklist(BlocklistLoader loader, SupportersProperties properties) {
        return loader.load(properties.getBlocklistLocation());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
