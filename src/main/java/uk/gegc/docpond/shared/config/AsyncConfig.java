package uk.gegc.docpond.shared.config;

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
 * Worker pools for the ingestion pipeline.
 *
 * <ul>
 *   <li>{@code pageTaskExecutor} runs one OCR job per page; each job holds its worker for the
 *   whole rasterize, OCR, extract and persist sequence.</li>
 *   <li>{@code documentTaskExecutor} runs document-level work: page counting, thumbnail
 *   generation and splitting.</li>
 * </ul>
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.page.core-pool-size:2}")
    private int pageCorePoolSize;

    @Value("${async.page.max-pool-size:4}")
    private int pageMaxPoolSize;

    @Value("${async.page.queue-capacity:500}")
    private int pageQueueCapacity;

    @Value("${async.page.keep-alive-seconds:60}")
    private int pageKeepAliveSeconds;

    @Value("${async.document.core-pool-size:2}")
    private int documentCorePoolSize;

    @Value("${async.document.max-pool-size:4}")
    private int documentMaxPoolSize;

    @Value("${async.document.queue-capacity:50}")
    private int documentQueueCapacity;

    @Value("${async.document.keep-alive-seconds:60}")
    private int documentKeepAliveSeconds;

    @Bean(name = "pageTaskExecutor")
    public Executor pageTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pageCorePoolSize);
        executor.setMaxPoolSize(pageMaxPoolSize);
        executor.setQueueCapacity(pageQueueCapacity);
        executor.setKeepAliveSeconds(pageKeepAliveSeconds);
        executor.setThreadNamePrefix("page-");
        // Queue full: the splitting thread runs the page itself instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Page Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                pageCorePoolSize, pageMaxPoolSize, pageQueueCapacity, pageKeepAliveSeconds);
        return executor;
    }

    @Bean(name = "documentTaskExecutor")
    public Executor documentTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(documentCorePoolSize);
        executor.setMaxPoolSize(documentMaxPoolSize);
        executor.setQueueCapacity(documentQueueCapacity);
        executor.setKeepAliveSeconds(documentKeepAliveSeconds);
        executor.setThreadNamePrefix("document-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Document Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                documentCorePoolSize, documentMaxPoolSize, documentQueueCapacity, documentKeepAliveSeconds);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return documentTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        java.util.Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
