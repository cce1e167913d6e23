package uk.gegc.studyscheduler.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool backing the recurring local ticks (session timer polls and reminder polls).
 */
@Configuration
@Slf4j
public class TickSchedulerConfig {

    @Value("${study.scheduler.pool-size:2}")
    private int poolSize;

    @Bean(name = "studyTickScheduler")
    public ThreadPoolTaskScheduler studyTickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("study-tick-");

        // Cancelled ticks are dropped from the queue instead of lingering until their next run
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(throwable ->
                log.error("Uncaught exception in study tick", throwable));
        return scheduler;
    }
}
