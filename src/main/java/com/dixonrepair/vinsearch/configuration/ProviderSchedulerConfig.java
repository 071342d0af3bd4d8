package com.dixonrepair.vinsearch.configuration;

import com.dixonrepair.vinsearch.config.ExecutorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Thread pool for concurrent provider calls.
 *
 * Every (query, provider) pair of a tier is subscribed on this scheduler so
 * provider implementations that block still run in parallel.
 */
@Slf4j
@Configuration
public class ProviderSchedulerConfig {

    @Bean(name = "providerTaskExecutor")
    public ThreadPoolTaskExecutor providerTaskExecutor(ExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());

        // Thread name prefix for debugging
        executor.setThreadNamePrefix("provider-call-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());

        executor.initialize();

        log.info("✅ Provider executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                props.getQueueCapacity());

        return executor;
    }

    @Bean(name = "providerScheduler", destroyMethod = "dispose")
    public Scheduler providerScheduler(ThreadPoolTaskExecutor providerTaskExecutor) {
        return Schedulers.fromExecutorService(providerTaskExecutor.getThreadPoolExecutor(), "provider-calls");
    }
}
