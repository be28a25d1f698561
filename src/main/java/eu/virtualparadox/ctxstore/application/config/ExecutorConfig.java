package eu.virtualparadox.ctxstore.application.config;

import eu.virtualparadox.ctxstore.application.executor.EmbeddingExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public EmbeddingExecutor embeddingExecutor() {
        EmbeddingExecutor executor = new EmbeddingExecutor();
        executor.setCorePoolSize(1);        // chunks are embedded one at a time
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("embed-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
