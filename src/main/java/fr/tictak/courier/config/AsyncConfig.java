package fr.tictak.courier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;

@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    public static final String LOCATION_EXECUTOR = "locationExecutor";

    @Value("${courier.location.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${courier.location.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${courier.location.executor.queue-capacity:10000}")
    private int queueCapacity;

    @Bean(name = LOCATION_EXECUTOR)
    public ThreadPoolTaskExecutor locationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("location-store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Background task {} failed with params {}: {}",
                method.getName(), Arrays.toString(params), ex.getMessage(), ex);
    }
}
