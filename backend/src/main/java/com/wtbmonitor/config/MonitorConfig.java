package com.wtbmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.service.StoreTargetService;
import com.wtbmonitor.market.source.ExternalCommandScrapeSource;
import com.wtbmonitor.market.source.ScrapeSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MonitorConfig {

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor() {
        return Executors.newFixedThreadPool(ScrapeKind.values().length, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scrape-run");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "progressExecutor", destroyMethod = "shutdownNow")
    public ExecutorService progressExecutor() {
        return Executors.newFixedThreadPool(ScrapeKind.values().length, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scrape-progress");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ScrapeSource wtbScrapeSource(
        MonitorProperties properties,
        ObjectMapper objectMapper,
        StoreTargetService storeTargetService
    ) {
        return new ExternalCommandScrapeSource(
            ScrapeKind.WTB,
            properties.getScraper().getWtb(),
            objectMapper,
            storeTargetService::enabledTargets
        );
    }

    @Bean
    public ScrapeSource inventoryScrapeSource(MonitorProperties properties, ObjectMapper objectMapper) {
        return new ExternalCommandScrapeSource(ScrapeKind.INVENTORY, properties.getScraper().getInventory(), objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
