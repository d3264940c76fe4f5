package com.outreachagent.infrastructure.config;

import com.outreachagent.infrastructure.pacing.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineExecutionConfig {

    public static final String PIPELINE_EXECUTOR = "pipelineExecutor";
    public static final String EVENT_STREAM_EXECUTOR = "eventStreamExecutor";

    /**
     * Single worker thread: at most one run executes at a time.
     */
    @Bean(name = PIPELINE_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("pipeline-worker"));
    }

    @Bean(name = EVENT_STREAM_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService eventStreamExecutor() {
        return Executors.newCachedThreadPool(namedThreads("event-stream"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
