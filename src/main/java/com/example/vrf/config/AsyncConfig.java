package com.example.vrf.config;

import com.example.vrf.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executor for @Async work (settlement, commitment uploads) and
 * scheduling for the housekeeping jobs.
 *
 * A full queue runs the task on the caller thread, so a settlement is never dropped.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableAsync
@EnableScheduling
@RequiredArgsConstructor
public class AsyncConfig implements AsyncConfigurer {

  public static final String BACKGROUND_EXECUTOR = "backgroundTaskExecutor";

  private final ApplicationProperties properties;

  @Bean(name = BACKGROUND_EXECUTOR)
  public ThreadPoolTaskExecutor backgroundTaskExecutor() {
    ApplicationProperties.AsyncProperties async = properties.async();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.corePoolSize());
    executor.setMaxPoolSize(async.maxPoolSize());
    executor.setQueueCapacity(async.queueCapacity());
    executor.setThreadNamePrefix("vrf-background-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(async.shutdownTimeout().toMillis());
    log.info("Configured background executor: core={}, max={}, queue={}",
             async.corePoolSize(), async.maxPoolSize(), async.queueCapacity());
    return executor;
  }

  @Override
  public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
    return (ex, method, params) ->
        log.error("Background task {} failed", method.getName(), ex);
  }
}
