package com.github.dimitryivaniuta.outreach.passes.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Invokes the worker periodically when {@code app.worker.scheduler-enabled=true}.
 *
 * <p>Off by default: deployments normally invoke the worker through an external scheduler calling
 * {@code POST /internal/pass-worker/runs}.</p>
 */
@Component
@ConditionalOnProperty(name = "app.worker.scheduler-enabled", havingValue = "true")
public class ScheduledPassWorkerTrigger {

    private static final Logger log = LoggerFactory.getLogger(ScheduledPassWorkerTrigger.class);

    private final PassGenerationWorker worker;

    public ScheduledPassWorkerTrigger(PassGenerationWorker worker) {
        this.worker = worker;
    }

    @Scheduled(fixedDelayString = "${app.worker.interval-ms:10000}")
    public void trigger() {
        try {
            worker.runOnce();
        } catch (RuntimeException ex) {
            log.error("Scheduled worker run failed", ex);
        }
    }
}
