package com.sqljudge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@EnableConfigurationProperties(JudgeProperties.class)
public class JudgeConfig {

    @Bean(destroyMethod = "shutdownNow")
    @Primary
    public ExecutorService fixtureExecutor(JudgeProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerCount(),
                new CustomizableThreadFactory("fixture-eval-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService queryTimeoutScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("query-timeout-");
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }
}
