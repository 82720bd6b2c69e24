package br.com.may.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async executors. Billing side effects (emails after a committed activation or failure) run on
 * {@code notificationTaskExecutor} so a slow mail server never holds a webhook request thread.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.notification.core-pool-size:2}")
    private int notificationCorePoolSize;

    @Value("${async.notification.max-pool-size:4}")
    private int notificationMaxPoolSize;

    @Value("${async.notification.queue-capacity:100}")
    private int notificationQueueCapacity;

    @Bean(name = "notificationTaskExecutor")
    public Executor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notificationCorePoolSize);
        executor.setMaxPoolSize(notificationMaxPoolSize);
        executor.setQueueCapacity(notificationQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("notify-");
        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Notification Task Executor configured - Core: {}, Max: {}, Queue: {}",
                notificationCorePoolSize, notificationMaxPoolSize, notificationQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return notificationTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}()",
                        method.getDeclaringClass().getSimpleName(), method.getName(), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
