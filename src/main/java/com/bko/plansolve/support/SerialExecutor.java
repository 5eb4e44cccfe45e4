package com.bko.plansolve.support;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs submitted commands one at a time, in submission order, on a shared executor.
 * Each session and each connection owns one, which makes it the single writer of its state.
 */
@Slf4j
public class SerialExecutor implements Executor {

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor executor;
    private final String name;
    private Runnable active;

    public SerialExecutor(Executor executor, String name) {
        this.executor = executor;
        this.name = name;
    }

    @Override
    public synchronized void execute(Runnable command) {
        tasks.add(() -> {
            try {
                command.run();
            } catch (RuntimeException ex) {
                log.error("Command failed on {}", name, ex);
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            executor.execute(active);
        }
    }

    public synchronized int pending() {
        return tasks.size();
    }

    public String name() {
        return name;
    }
}
