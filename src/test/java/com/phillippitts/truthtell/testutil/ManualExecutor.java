package com.phillippitts.truthtell.testutil;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Executor that holds submitted tasks until the test runs them explicitly.
 */
public class ManualExecutor implements Executor {
    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.addLast(command);
    }

    /**
     * Runs queued tasks (including ones submitted while running) until none remain.
     *
     * @return number of tasks run
     */
    public int runAll() {
        int count = 0;
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
            count++;
        }
        return count;
    }

    public synchronized int pendingTasks() {
        return tasks.size();
    }

    private synchronized Runnable poll() {
        return tasks.pollFirst();
    }
}
