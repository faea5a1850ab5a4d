package com.mealvision.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    /** 一張照片一個 task；task 內部不再平行 */
    @Bean("mealPhotoExecutor")
    public TaskExecutor mealPhotoExecutor(
            @Value("${app.pipeline.executor.core-pool-size:2}") int corePoolSize,
            @Value("${app.pipeline.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${app.pipeline.executor.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(corePoolSize);
        ex.setMaxPoolSize(maxPoolSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setThreadNamePrefix("meal-photo-");
        ex.initialize();
        return ex;
    }
}
