package io.github.drompincen.annostore.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool running index chores and global searches.
 */
@Configuration
public class TaskExecutorConfig {

    @Bean
    ThreadPoolTaskExecutor backgroundTaskExecutor(@Value("${annostore.tasks.pool-size:4}") int poolSize,
                                                  @Value("${annostore.tasks.queue-capacity:100}") int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("annostore-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
