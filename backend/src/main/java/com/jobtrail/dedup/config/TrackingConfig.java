package com.jobtrail.dedup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TrackingConfig {

    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(TrackingProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getWorkerThreads());
    }

    @Bean
    public Clock trackingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionTemplate trackingTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
