package com.bko.plansolve.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient chatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(PlanSolveProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getWorkerThreads());
    }

    /**
     * Backs the per-session mailboxes and per-connection inbound queues.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pipelineScheduler() {
        return Executors.newScheduledThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
