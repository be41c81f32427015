package org.csits.butler.server.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * 生成流水线所需的线程池与 HTTP 客户端。
 */
@Configuration
@EnableScheduling
public class PipelineConfig {

    /**
     * 执行生成任务的线程池
     */
    @Bean("generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor(
        @Value("${butler.pipeline.core-pool-size:4}") int corePoolSize,
        @Value("${butler.pipeline.max-pool-size:8}") int maxPoolSize,
        @Value("${butler.pipeline.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("gen-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 持久化镜像写入线程，单线程保证按提交顺序落库
     */
    @Bean("persistenceExecutor")
    public ThreadPoolTaskExecutor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("task-persist-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean("providerRestTemplate")
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder,
        @Value("${butler.provider.connect-timeout-ms:10000}") long connectTimeoutMs,
        @Value("${butler.provider.timeout-ms:180000}") long readTimeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .build();
    }
}
