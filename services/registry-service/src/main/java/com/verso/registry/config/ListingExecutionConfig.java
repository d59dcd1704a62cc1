package com.verso.registry.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ListingExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor(RegistryProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getListing().getFanOutPoolSize()));
    }
}
