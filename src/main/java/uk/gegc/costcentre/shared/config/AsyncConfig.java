package uk.gegc.costcentre.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for work that must not block a billing request.
 *
 * <p>The usage dispatch pool pushes incremental usage to the billing provider after
 * a finalize has committed. When its queue is full a new report is rejected rather than run
 * on the submitting thread; the dispatcher counts and drops it.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.dispatch.core-pool-size:2}")
    private int dispatchCorePoolSize;

    @Value("${async.dispatch.max-pool-size:4}")
    private int dispatchMaxPoolSize;

    @Value("${async.dispatch.queue-capacity:100}")
    private int dispatchQueueCapacity;

    @Value("${async.dispatch.keep-alive-seconds:60}")
    private int dispatchKeepAliveSeconds;

    @Bean(name = "usageDispatchExecutor")
    public ThreadPoolTaskExecutor usageDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatchCorePoolSize);
        executor.setMaxPoolSize(dispatchMaxPoolSize);
        executor.setQueueCapacity(dispatchQueueCapacity);
        executor.setKeepAliveSeconds(dispatchKeepAliveSeconds);
        executor.setThreadNamePrefix("usage-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Usage dispatch executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                dispatchCorePoolSize, dispatchMaxPoolSize, dispatchQueueCapacity, dispatchKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return usageDispatchExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
