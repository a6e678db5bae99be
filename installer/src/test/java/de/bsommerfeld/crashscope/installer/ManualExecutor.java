package de.bsommerfeld.crashscope.installer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Queues submitted workers until the test runs them, so the test decides
 * exactly when a background attempt makes progress.
 */
final class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.add(command);
    }

    synchronized int pending() {
        return tasks.size();
    }

    void runNext() {
        Runnable task;
        synchronized (this) {
            task = tasks.poll();
        }
        assertNotNull(task, "No worker was submitted");
        task.run();
    }
}
