package com.phillippitts.pingwatch.service.process;

import com.phillippitts.pingwatch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Terminates external processes: graceful {@link Process#destroy()} first, then
 * {@link Process#destroyForcibly()} when the process ignores it.
 */
public final class ProcessReaper {

    private static final Logger LOG = LogManager.getLogger(ProcessReaper.class);

    private ProcessReaper() {
    }

    /**
     * Destroys the process and waits for it to exit, escalating to a forcible kill.
     * Never throws; an interrupt is preserved on the calling thread.
     *
     * @param process process to terminate (may already be dead)
     */
    public static void destroy(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
