package eu.virtualparadox.finrag.application.config;

import eu.virtualparadox.finrag.application.executor.PageExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    @Bean
    public PageExecutor pageExecutor(@Value("${finrag.pipeline.page-concurrency:4}") final int pageConcurrency) {
        PageExecutor executor = new PageExecutor();
        executor.setCorePoolSize(pageConcurrency);   // fan-out width per process
        executor.setMaxPoolSize(pageConcurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE); // pages wait, never rejected
        executor.setThreadNamePrefix("page-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
