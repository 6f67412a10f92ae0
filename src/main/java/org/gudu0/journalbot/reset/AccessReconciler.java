package org.gudu0.journalbot.reset;

import org.gudu0.journalbot.journal.AccessController;
import org.gudu0.journalbot.util.ConsoleLog;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically retries grants and revokes whose external call failed earlier.
 */
public class AccessReconciler {

    private final AccessController access;
    private final long intervalMinutes;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "AccessReconciler");
        t.setDaemon(true);
        return t;
    });

    public AccessReconciler(AccessController access, long intervalMinutes) {
        this.access = access;
        this.intervalMinutes = intervalMinutes;
    }

    public void start() {
        ConsoleLog.info("Reconciler", "Starting scheduler (every " + intervalMinutes + " min)");
        scheduler.scheduleWithFixedDelay(this::runSafe, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown));
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    private void runSafe() {
        try {
            access.reconcile();
        } catch (Exception e) {
            ConsoleLog.error("Reconciler", "Reconcile pass failed: " + e.getMessage(), e);
        }
    }
}
