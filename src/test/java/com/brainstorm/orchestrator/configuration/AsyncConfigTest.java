package com.brainstorm.orchestrator.configuration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@DisplayName("Async Config Tests")
class AsyncConfigTest {

    private final AsyncConfig config = new AsyncConfig();

    @Test
    @DisplayName("Turn-path pools reject work when saturated rather than running it on the caller")
    void turnPools_ShouldAbortWhenSaturated() {
        ThreadPoolTaskExecutor agents = config.agentExecutor();
        ThreadPoolTaskExecutor context = config.contextExecutor();
        try {
            assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class,
                    agents.getThreadPoolExecutor().getRejectedExecutionHandler());
            assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class,
                    context.getThreadPoolExecutor().getRejectedExecutionHandler());
        } finally {
            agents.shutdown();
            context.shutdown();
        }
    }
}
