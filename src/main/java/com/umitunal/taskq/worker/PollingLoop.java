package com.umitunal.taskq.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A background thread that runs a tick, waits for the interval, and repeats until stopped.
 * A failing tick is logged and the loop carries on with the next one.
 */
public class PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    private final String name;
    private final Duration interval;
    private final Tick tick;
    private final Duration joinTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    // guarded by lock; set when a wake-up arrives while no wait is in progress
    private boolean wakeUpPending;

    private volatile Thread thread;

    public PollingLoop(String name, Duration interval, Tick tick, Duration joinTimeout) {
        this.name = name;
        this.interval = interval;
        this.tick = tick;
        this.joinTimeout = joinTimeout;
    }

    /**
     * Start the loop thread. Does nothing if already running.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread worker = new Thread(this::run, name);
            worker.setDaemon(false);
            thread = worker;
            worker.start();
        }
    }

    /**
     * Stop the loop and wait for the tick in progress to return. Called from inside a tick,
     * it only clears the running flag.
     *
     * @return false if the loop thread was still busy when the join timeout elapsed
     */
    public boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return true;
        }
        signal();

        Thread worker = thread;
        if (worker == null || worker == Thread.currentThread()) {
            return true;
        }
        try {
            worker.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            log.warn("{} did not finish its current tick within {}", name, joinTimeout);
            return false;
        }
        return true;
    }

    /**
     * Cut the current wait short so the next tick runs immediately. A wake-up that arrives
     * during a tick skips the wait that follows it.
     */
    public void wakeUp() {
        lock.lock();
        try {
            wakeUpPending = true;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void run() {
        log.debug("{} started, interval {}", name, interval);
        while (running.get()) {
            try {
                tick.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("{} tick failed", name, e);
            }

            try {
                awaitNextTick();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        running.set(false);
        log.debug("{} stopped", name);
    }

    private void awaitNextTick() throws InterruptedException {
        lock.lock();
        try {
            if (running.get() && !wakeUpPending) {
                wakeUp.await(interval.toMillis(), TimeUnit.MILLISECONDS);
            }
            wakeUpPending = false;
        } finally {
            lock.unlock();
        }
    }

    private void signal() {
        lock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * One iteration of the loop.
     */
    @FunctionalInterface
    public interface Tick {
        void run() throws Exception;
    }
}
