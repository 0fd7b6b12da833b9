package de.tu_berlin.dos.arm.envsense.core;

import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs poll cycles, one at a time. A trigger that arrives while a cycle is in progress is dropped, since
 * the merge step assumes it is the only writer of the history store.
 */
public class SensorPipeline implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SensorPipeline.class);

    private final Context context;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private ScheduledFuture<?> schedule;

    public SensorPipeline(Context context) {

        this.context = context;
    }

    /**
     * Executes one pass of fetch, normalize, merge and, when new rows arrived, persist and retrain.
     * Re-running it on data that was already merged is a no-op.
     */
    public CycleReport runCycle() {

        if (!running.compareAndSet(false, true)) {

            LOG.warn("Cycle already in progress, dropping trigger");
            return CycleReport.dropped();
        }
        try {
            LOG.info("Polling for new batch...");
            Cycle cycle = new Cycle(context, stopping::get);
            List<CycleManager> path;
            try {
                path = CycleManager.START.run(CycleManager.class, cycle);
            }
            catch (Exception e) {

                LOG.error("Cycle failed: " + e.getMessage(), e);
                cycle.abandon("unexpected failure: " + e.getMessage());
                path = Collections.singletonList(CycleManager.START);
            }
            CycleReport report = cycle.report(path);
            LOG.info(report);
            return report;
        }
        finally {
            running.set(false);
        }
    }

    /**
     * Runs a first cycle right away, then one cycle every poll interval after the previous one finished.
     */
    public synchronized void start() {

        if (schedule != null) throw new IllegalStateException("Pipeline already started");
        schedule = context.executor.scheduleWithFixedDelay(this::runCycle, 0, context.pollMinutes, TimeUnit.MINUTES);
        LOG.info("Scheduler started, polling every " + context.pollMinutes + " minutes");
    }

    /**
     * Stops scheduling; a running cycle ends at its next state boundary.
     */
    @Override
    public synchronized void close() {

        stopping.set(true);
        if (schedule != null) schedule.cancel(false);
    }
}
