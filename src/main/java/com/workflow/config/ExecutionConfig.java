package com.workflow.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans used by the execution engine.
 */
@Configuration
public class ExecutionConfig {

    /**
     * The pool handlers run on when a per-step timeout is configured. Threads are daemons so
     * an abandoned, non-interruptible handler cannot keep the JVM alive.
     */
    @Bean(name = "workflowStepExecutor", destroyMethod = "shutdownNow")
    public ExecutorService workflowStepExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "workflow-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
