package com.flow.service;

import com.flow.store.BaselineStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background updater for the {@link BaselineStore}: restores persisted days on
 * startup, drains the record queue on a fixed delay and runs the daily recompute.
 * The scoring path never waits on any of this.
 */
@Component
public class BaselineMaintenanceJob {

    private static final Logger log = LoggerFactory.getLogger(BaselineMaintenanceJob.class);

    private final BaselineStore baselineStore;

    public BaselineMaintenanceJob(BaselineStore baselineStore) {
        this.baselineStore = baselineStore;
    }

    @PostConstruct
    public void restore() {
        baselineStore.loadFromRepository();
    }

    @Scheduled(fixedDelayString = "${flow.baseline.drain-interval-ms:500}")
    public void drain() {
        try {
            baselineStore.applyPending();
        } catch (RuntimeException e) {
            log.error("Baseline drain failed, {} windows still queued", baselineStore.pendingCount(), e);
        }
    }

    @Scheduled(cron = "${flow.baseline.recompute-cron:0 5 0 * * *}", zone = "UTC")
    public void recompute() {
        try {
            baselineStore.applyPending();
            baselineStore.recomputeAll();
        } catch (RuntimeException e) {
            log.error("Baseline recompute failed", e);
        }
    }

    /**
     * Apply whatever the last evaluation queued before the context closes.
     */
    @PreDestroy
    public void shutdown() {
        int applied = baselineStore.applyPending();
        log.info("Shutdown: applied {} pending baseline windows", applied);
    }
}
