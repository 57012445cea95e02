package github.sarthakdev143.reel_forge.config;

import github.sarthakdev143.reel_forge.model.StageWeightTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    /**
     * One thread per running task. The unbounded queue defers excess submissions instead of rejecting them.
     */
    @Bean(name = "generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor(ReelForgeProperties properties) {
        int maxConcurrent = Math.max(1, properties.tasks().maxConcurrent());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrent);
        executor.setMaxPoolSize(maxConcurrent);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("generation-task-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "sceneWorkExecutor")
    public ThreadPoolTaskExecutor sceneWorkExecutor(ReelForgeProperties properties) {
        int poolSize = Math.max(1, properties.tasks().maxConcurrent() * properties.tasks().sceneConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("scene-work-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "providerCallExecutor")
    public ThreadPoolTaskExecutor providerCallExecutor(ReelForgeProperties properties) {
        int poolSize = Math.max(2, properties.tasks().maxConcurrent() * properties.tasks().sceneConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("provider-call-");
        executor.initialize();
        return executor;
    }

    @Bean
    public StageWeightTable stageWeightTable(ReelForgeProperties properties) {
        return properties.stageWeightTable();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
