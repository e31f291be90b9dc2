package com.newsdigest.bot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
@Slf4j
public class AsyncConfig {

    /**
     * 소스 수집 전용 실행자 (소스당 하나의 작업)
     */
    @Bean(name = "sourceFetchExecutor")
    public ThreadPoolTaskExecutor sourceFetchExecutor(DigestProperties properties) {
        int poolSize = properties.getFetch().getPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(properties.getSources().size(), 1) * 2);
        executor.setThreadNamePrefix("source-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getFetch().getTimeoutSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 수동 트리거 전용 실행자. 단일 스레드라 트리거가 순서대로 처리됩니다.
     */
    @Bean(name = "digestControlExecutor")
    public ThreadPoolTaskExecutor digestControlExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("digest-control-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Task rejected from digestControlExecutor: {}", r.toString()));
        executor.initialize();
        return executor;
    }
}
