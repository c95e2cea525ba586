package com.flow.config;

import com.flow.aggregator.PressureAggregator;
import com.flow.comparison.ComparisonHarness;
import com.flow.engine.AlgorithmVariant;
import com.flow.engine.SignalAlgorithm;
import com.flow.engine.SignalEngine;
import com.flow.engine.VolumeRatioAlgorithm;
import com.flow.store.BaselineRepository;
import com.flow.store.BaselineStore;
import com.flow.store.JdbcBaselineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Application-wide Spring configuration. The detection core is plain Java;
 * this is the only place it is wired together.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(DetectionConfig.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BaselineRepository baselineRepository(DataSource dataSource) {
        return new JdbcBaselineRepository(dataSource);
    }

    @Bean
    public BaselineStore baselineStore(DetectionConfig config, BaselineRepository repository, Clock clock) {
        return new BaselineStore(config.baseline(), repository, clock);
    }

    @Bean
    public PressureAggregator pressureAggregator(DetectionConfig config) {
        return new PressureAggregator(config.window().windowLength(), config.window().idleTimeout());
    }

    @Bean
    public SignalEngine signalEngine(DetectionConfig config, BaselineStore baselineStore) {
        return SignalEngine.create(config, baselineStore);
    }

    @Bean
    public VolumeRatioAlgorithm volumeRatioAlgorithm(DetectionConfig config) {
        return new VolumeRatioAlgorithm(config);
    }

    /**
     * The algorithm that drives live evaluation, chosen once by {@code flow.algorithm}.
     */
    @Bean
    @Primary
    public SignalAlgorithm signalAlgorithm(
            @Value("${flow.algorithm:INSTITUTIONAL_FLOW}") AlgorithmVariant variant,
            SignalEngine signalEngine,
            VolumeRatioAlgorithm volumeRatioAlgorithm) {
        SignalAlgorithm selected = switch (variant) {
            case INSTITUTIONAL_FLOW -> signalEngine;
            case VOLUME_RATIO -> volumeRatioAlgorithm;
        };
        log.info("Selected signal algorithm: {}", selected.name());
        return selected;
    }

    @Bean
    public ComparisonHarness comparisonHarness(SignalEngine signalEngine, VolumeRatioAlgorithm volumeRatioAlgorithm) {
        return new ComparisonHarness(signalEngine, volumeRatioAlgorithm);
    }

    /**
     * Dedicated task scheduler for scheduled methods ({@code @Scheduled}).
     *
     * <p>Configured with enough threads to run the generator, evaluation, eviction
     * and baseline jobs concurrently without blocking.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(5);
        scheduler.setThreadNamePrefix("flow-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }
}
