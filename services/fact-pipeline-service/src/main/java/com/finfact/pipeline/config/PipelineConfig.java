package com.finfact.pipeline.config;

import com.finfact.pipeline.service.LocalRunReportStorage;
import com.finfact.pipeline.service.RunReportStorage;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PipelineConfig {

    @Bean
    ThreadPoolTaskExecutor extractionExecutor(PipelineProperties properties) {
        int poolSize = Math.max(1, properties.getWorkerPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("extract-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    RunReportStorage runReportStorage(PipelineProperties properties) {
        return new LocalRunReportStorage(Path.of(properties.getRunReportPath()));
    }
}
