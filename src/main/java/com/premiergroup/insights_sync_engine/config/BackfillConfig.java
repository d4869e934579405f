package com.premiergroup.insights_sync_engine.config;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;

@Configuration(proxyBeanMethods = false)
public class BackfillConfig {

    @Value("${insights.backfill.default-delay:1s}")
    private Duration defaultDelay;

    @Value("${insights.backfill.levels:CAMPAIGN,AD}")
    private List<EntityLevel> levels;

    @Value("${insights.backfill.aggregate-on-completion:true}")
    private boolean aggregateOnCompletion;

    @Bean
    public BackfillSettings backfillSettings() {
        return new BackfillSettings(defaultDelay, levels, aggregateOnCompletion);
    }

    /**
     * One thread: a backfill is single-flight and days are processed in order. The one queue
     * slot takes the next run while the previous worker thread is still returning to the pool.
     */
    @Bean
    public ThreadPoolTaskExecutor backfillTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("backfill-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
