package com.questrail.transition.internal.exec;

import com.questrail.transition.api.ContractViolationException;
import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.core.StateManager;
import com.questrail.transition.internal.time.SystemWallClock;
import com.questrail.transition.internal.time.WallClock;
import com.questrail.transition.observability.DispatchErrorEvent;
import com.questrail.transition.observability.NullObservabilitySink;
import com.questrail.transition.observability.TransitionObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SerializedDispatchDriver
 * =============================================================================
 * Runs a single-consumer loop in front of a {@link StateManager}, so that many
 * producers can submit changes while the manager keeps its single logical
 * writer.
 *
 * <h2>Threading Model</h2>
 * The driver owns one thread. Changes are queued and dispatched strictly in
 * submission order; the events of each dispatch are handed to the
 * {@link EventHandler} on the same thread before the next change is taken.
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>An exception thrown by the event handler is reported to the
 *       observability sink and the loop continues.</li>
 *   <li>Interrupting the loop thread stops the driver; queued changes are
 *       discarded.</li>
 *   <li>Any exception from the manager, typically a
 *       {@link ContractViolationException}, is fatal. It is recorded (see
 *       {@link #failure()}) and the loop terminates; changes still queued are
 *       discarded.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()        → starts the loop thread
 *   driver.submit(...)    → enqueues a change
 *   driver.stop()         → stops the loop and waits for it
 * </pre>
 */
public final class SerializedDispatchDriver<S extends State, C extends StateChange, E extends Event> {

    private final StateManager<S, C, E> manager;
    private final EventHandler<E> handler;
    private final TransitionObservabilitySink observabilitySink;
    private final WallClock clock;

    private final BlockingQueue<C> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile Thread loopThread;
    private volatile RuntimeException failure;

    public SerializedDispatchDriver(StateManager<S, C, E> manager,
                                    EventHandler<E> handler,
                                    TransitionObservabilitySink observabilitySink,
                                    WallClock clock)
    {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNullElse(clock, SystemWallClock.INSTANCE);
    }

    public SerializedDispatchDriver(StateManager<S, C, E> manager, EventHandler<E> handler) {
        this(manager, handler, null, null);
    }

    /**
     * Starts the loop thread.
     * Idempotent while running; a driver that has failed cannot be restarted.
     */
    public void start() {
        if (failure != null) {
            throw new IllegalStateException("Driver for '" + manager.name() + "' has failed", failure);
        }
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "dispatch-driver-" + manager.name());
            loopThread.start();
        }
    }

    /**
     * Stops the loop thread and waits for it to terminate.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = loopThread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Enqueues a change for dispatch.
     *
     * @param change the change (must not be null)
     * @return {@code false} if the change will not be dispatched because the
     *         driver is not running or has failed
     */
    public boolean submit(C change) {
        Objects.requireNonNull(change, "change");
        if (!running.get()) {
            return false;
        }
        if (!queue.offer(change)) {
            return false;
        }
        // The loop may have failed and cleared the queue between the checks above.
        return failure == null;
    }

    /**
     * Returns a snapshot of the manager's state.
     * Thread-safe: never observes a dispatch in progress.
     */
    public Optional<S> currentState() {
        synchronized (stateLock) {
            return manager.currentState();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns the exception that terminated the loop, if any.
     */
    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(failure);
    }

    private void runLoop() {
        while (running.get()) {
            C change;
            try {
                change = queue.take();
            } catch (InterruptedException e) {
                // Interruption means shutdown, whether from stop() or the thread's owner.
                running.set(false);
                queue.clear();
                Thread.currentThread().interrupt();
                return;
            }

            List<E> events;
            try {
                synchronized (stateLock) {
                    events = manager.dispatch(change);
                }
            } catch (RuntimeException e) {
                // Contract violations were already reported by the manager.
                if (!(e instanceof ContractViolationException)) {
                    observabilitySink.onError(new DispatchErrorEvent(
                        clock.now(),
                        manager.name(),
                        "Dispatch failed for " + change,
                        e
                    ));
                }
                failure = e;
                running.set(false);
                queue.clear();
                return;
            }

            try {
                handler.handle(events);
            } catch (RuntimeException e) {
                observabilitySink.onError(new DispatchErrorEvent(
                    clock.now(),
                    manager.name(),
                    "Event handler failed for " + change,
                    e
                ));
            }
        }
    }
}
