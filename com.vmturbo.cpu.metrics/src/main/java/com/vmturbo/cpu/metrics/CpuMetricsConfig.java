package com.vmturbo.cpu.metrics;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.vmturbo.cpu.metrics.counters.CounterDurationSummarizer;
import com.vmturbo.cpu.metrics.cycles.CycleAggregator;
import com.vmturbo.cpu.metrics.idle.IdleStatsCalculator;
import com.vmturbo.cpu.metrics.idle.IdleTimeInStateCalculator;
import com.vmturbo.cpu.metrics.timeline.TimelineBuilder;
import com.vmturbo.cpu.metrics.timeline.TracePartitioner;
import com.vmturbo.cpu.metrics.utilization.UtilizationAggregator;
import com.vmturbo.cpu.metrics.window.IntervalSplitter;

/**
 * Spring configuration for the CPU metrics engine.
 */
@Configuration
public class CpuMetricsConfig {

    private static final Logger logger = LogManager.getLogger();

    @Value("${cpuMetricsUtilizationPeriodNs:1000000000}")
    private long utilizationPeriodNs;

    /**
     * Number of CPUs processed concurrently. 1 runs every task on the calling thread.
     */
    @Value("${cpuMetricsParallelism:1}")
    private int parallelism;

    @Value("${cpuMetricsIdleStatePrefix:cpuidle.}")
    private String idleStatePrefix;

    @Value("${cpuMetricsActiveStateName:C0}")
    private String activeStateName;

    @Bean
    public TracePartitioner tracePartitioner() {
        return new TracePartitioner();
    }

    @Bean
    public TimelineBuilder timelineBuilder() {
        return new TimelineBuilder();
    }

    @Bean
    public IntervalSplitter intervalSplitter() {
        return new IntervalSplitter();
    }

    @Bean
    public UtilizationAggregator utilizationAggregator() {
        return new UtilizationAggregator(intervalSplitter());
    }

    @Bean
    public CycleAggregator cycleAggregator() {
        return new CycleAggregator(intervalSplitter());
    }

    @Bean
    public IdleStatsCalculator idleStatsCalculator() {
        return new IdleStatsCalculator();
    }

    @Bean
    public IdleTimeInStateCalculator idleTimeInStateCalculator() {
        return new IdleTimeInStateCalculator(idleStatePrefix, activeStateName);
    }

    @Bean
    public CounterDurationSummarizer counterDurationSummarizer() {
        return new CounterDurationSummarizer();
    }

    /**
     * Executor for the per-CPU tasks of a query.
     *
     * @return the executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService cpuMetricsExecutor() {
        if (parallelism <= 1) {
            return MoreExecutors.newDirectExecutorService();
        }
        logger.info("Computing cpu metrics with {} threads", parallelism);
        final ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("cpu-metrics-%d")
                .setDaemon(true)
                .build();
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }

    /**
     * The query entry point.
     *
     * @return the service
     */
    @Bean
    public CpuMetricsService cpuMetricsService() {
        return new CpuMetricsService(tracePartitioner(), timelineBuilder(),
                utilizationAggregator(), cycleAggregator(), idleStatsCalculator(),
                idleTimeInStateCalculator(), counterDurationSummarizer(), cpuMetricsExecutor(),
                utilizationPeriodNs);
    }
}
