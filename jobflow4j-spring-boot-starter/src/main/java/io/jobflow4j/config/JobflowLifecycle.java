package io.jobflow4j.config;

import io.jobflow4j.Jobflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler, executor and cleanup thread after every other bean is ready and stops
 * them first on shutdown, so running jobs are cancelled before their dependencies go away.
 */
public class JobflowLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobflowLifecycle.class);

    private final Jobflow jobflow;

    public JobflowLifecycle(Jobflow jobflow) {
        this.jobflow = jobflow;
    }

    @Override
    public void start() {
        jobflow.start();
    }

    @Override
    public void stop() {
        jobflow.stop();
    }

    /**
     * Executor shutdown may wait for workers, so it runs off the container's shutdown thread.
     */
    @Override
    public void stop(Runnable callback) {
        Thread t = new Thread(() -> {
            try {
                jobflow.stop();
            } catch (RuntimeException e) {
                log.error("jobflow shutdown failed msg={}", e.getMessage(), e);
            } finally {
                callback.run();
            }
        });
        t.setName("jobflow.shutdown");
        t.setDaemon(true);
        t.start();
    }

    @Override
    public boolean isRunning() {
        return jobflow.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
