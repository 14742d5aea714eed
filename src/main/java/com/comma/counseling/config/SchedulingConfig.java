package com.comma.counseling.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * Session dates and times are wall-clock values in this zone.
     */
    @Bean
    public Clock clock(@Value("${counseling.time-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${counseling.scheduler.pool-size:3}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("counseling-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }
}
