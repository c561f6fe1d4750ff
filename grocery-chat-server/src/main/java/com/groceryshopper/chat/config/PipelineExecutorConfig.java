package com.groceryshopper.chat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pools owned by the process.
 * The agent pipeline and background model downloads never run on request threads.
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean(name = "agentPipelineExecutor")
    public ThreadPoolTaskExecutor agentPipelineExecutor(
            @Value("${agent.pipeline.core-pool-size:4}") int corePoolSize,
            @Value("${agent.pipeline.max-pool-size:16}") int maxPoolSize,
            @Value("${agent.pipeline.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("agent-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "modelDownloadExecutor")
    public ThreadPoolTaskExecutor modelDownloadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("model-download-");
        executor.initialize();
        return executor;
    }
}
