package com.dataops.loader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for pipeline runs. One run occupies one thread from start to finish.
 */
@Configuration
public class AppConfig {

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(LoaderProperties properties) {
        LoaderProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(worker.getCorePoolSize());
        executor.setMaxPoolSize(worker.getMaxPoolSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("Pipeline-Run-");

        // A full queue rejects the submission instead of running it on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Let in-flight runs reach a batch boundary on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();
        return executor;
    }
}
