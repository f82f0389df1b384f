package com.example.dataingest.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
public class IngestionExecutorConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(IngestionProperties properties) {
        int threads = Math.max(1, properties.getParallelism());
        log.info("Creating ingestion executor with {} extraction threads", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("ingestion-"));
    }
}
