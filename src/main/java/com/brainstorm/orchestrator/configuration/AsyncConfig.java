package com.brainstorm.orchestrator.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by a turn.
 *
 * agentExecutor runs capability invocations of a phase, contextExecutor runs
 * the per-turn context fetches, persistenceExecutor runs fire-and-forget
 * message and activity writes.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "agentExecutor")
    public ThreadPoolTaskExecutor agentExecutor() {
        // saturated pool rejects; the orchestrator records the step as failed
        return build("agent-", 8, 32, 200, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "contextExecutor")
    public ThreadPoolTaskExecutor contextExecutor() {
        // rejected fetches degrade to empty context
        return build("context-", 4, 16, 100, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "persistenceExecutor")
    public ThreadPoolTaskExecutor persistenceExecutor() {
        return build("persist-", 2, 4, 500, new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor build(String prefix, int core, int max, int queue,
                                         RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);

        // Wait for tasks to complete on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Executor '{}' configured: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), queue);

        return executor;
    }
}
