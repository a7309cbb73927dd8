package io.jobargs4j.config;

import io.jobargs4j.internal.mongo.MongoJobRunner;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the job runner start/stop lifecycle with the Spring container lifecycle.
 */
public class JobArgsLifecycle implements SmartLifecycle {
    private final MongoJobRunner runner;

    public JobArgsLifecycle(MongoJobRunner runner) {
        this.runner = runner;
    }

    @Override
    public void start() {
        runner.start();
    }

    @Override
    public void stop() {
        runner.stop();
    }

    @Override
    public boolean isRunning() {
        return runner.isRunning();
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
