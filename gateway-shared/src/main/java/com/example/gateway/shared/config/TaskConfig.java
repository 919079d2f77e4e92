package com.example.gateway.shared.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    @PostConstruct
    void propagateMdcToSchedulers() {
        Schedulers.onScheduleHook(MdcScheduleHook.KEY, MdcScheduleHook::decorate);
    }

    @PreDestroy
    void resetScheduleHook() {
        Schedulers.resetOnScheduleHook(MdcScheduleHook.KEY);
    }

    /**
     * Thread pool for @Scheduled methods (media sweep).
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Timers: reconnection delays and per-subscriber heartbeats.
     * Nothing scheduled here may block; real work hops to boundedElastic.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler gatewayTimerScheduler() {
        return Schedulers.newParallel("gateway-timer-", 2);
    }

    /**
     * Blocking I/O off the event loop: registry calls from controllers,
     * media downloads and credential file access.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler gatewayIoScheduler() {
        return Schedulers.newBoundedElastic(50, 10000, "gateway-io-");
    }
}
