package com.questrail.transition.internal.exec;

import com.questrail.transition.api.ContractViolationException;
import com.questrail.transition.api.Iteration;
import com.questrail.transition.api.StateTransition;
import com.questrail.transition.config.StateManagerConfig;
import com.questrail.transition.core.StateManager;
import com.questrail.transition.example.ChannelChange;
import com.questrail.transition.example.ChannelEvent;
import com.questrail.transition.example.ChannelState;
import com.questrail.transition.example.ChannelTransition;
import com.questrail.transition.observability.DispatchErrorEvent;
import com.questrail.transition.observability.RecordingObservabilitySink;
import com.questrail.transition.test.exec.RecordingEventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SerializedDispatchDriverTest
 * -----------------------------------------------------------------------------
 * Tests the single-consumer loop in front of a state manager.
 */
class SerializedDispatchDriverTest {

    private SerializedDispatchDriver<ChannelState, ChannelChange, ChannelEvent> driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.stop();
        }
    }

    private static StateManager<ChannelState, ChannelChange, ChannelEvent> manager(
            StateTransition<ChannelState, ChannelChange, ChannelEvent> transition,
            RecordingObservabilitySink sink)
    {
        return new StateManager<>(transition, new ChannelState.Open("ch-1", 0, 0),
                StateManagerConfig.builder().withName("ch-1").withObservabilitySink(sink).build());
    }

    private static void awaitStopped(SerializedDispatchDriver<?, ?, ?> d) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (d.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    @Test
    void submitIsRefusedWhenNotRunning() {
        driver = new SerializedDispatchDriver<>(manager(new ChannelTransition(), new RecordingObservabilitySink()),
                events -> {});

        assertFalse(driver.submit(new ChannelChange.Deposit(1)));
    }

    @Test
    void changesAreDispatchedInSubmissionOrder() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(20);
        RecordingEventHandler<ChannelEvent> recorder = new RecordingEventHandler<>();
        driver = new SerializedDispatchDriver<>(manager(new ChannelTransition(), new RecordingObservabilitySink()),
                events -> {
                    recorder.handle(events);
                    latch.countDown();
                });
        driver.start();

        List<ChannelEvent> expected = new ArrayList<>();
        long balance = 0;
        for (int i = 1; i <= 20; i++) {
            balance += i;
            expected.add(new ChannelEvent.Deposited(i, balance));
            assertTrue(driver.submit(new ChannelChange.Deposit(i)));
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS), "all changes should be processed");
        assertEquals(expected, recorder.events());
        assertEquals(20, recorder.batches().size());
        assertEquals(Optional.of(new ChannelState.Open("ch-1", 210, 20)), driver.currentState());
    }

    @Test
    void handlerFailureIsReportedAndTheLoopContinues() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        CountDownLatch latch = new CountDownLatch(2);
        driver = new SerializedDispatchDriver<>(manager(new ChannelTransition(), sink),
                events -> {
                    latch.countDown();
                    if (latch.getCount() == 1) {
                        throw new IllegalStateException("network down");
                    }
                },
                sink, null);
        driver.start();

        driver.submit(new ChannelChange.Deposit(1));
        driver.submit(new ChannelChange.Deposit(2));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(driver.isRunning());
        assertTrue(sink.hasEventOfType(DispatchErrorEvent.class));
        assertEquals(Optional.of(new ChannelState.Open("ch-1", 3, 2)), driver.currentState());
    }

    @Test
    void contractViolationTerminatesTheLoop() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        StateTransition<ChannelState, ChannelChange, ChannelEvent> broken = (s, c) ->
                c instanceof ChannelChange.Settle ? null : new ChannelTransition().apply(s, c);
        driver = new SerializedDispatchDriver<>(manager(broken, sink), events -> {}, sink, null);
        driver.start();

        driver.submit(new ChannelChange.Deposit(5));
        driver.submit(new ChannelChange.Settle());
        driver.submit(new ChannelChange.Deposit(7));
        awaitStopped(driver);

        assertFalse(driver.isRunning());
        assertTrue(driver.failure().isPresent());
        assertInstanceOf(ContractViolationException.class, driver.failure().get());
        assertEquals(Optional.of(new ChannelState.Open("ch-1", 5, 1)), driver.currentState());
        assertEquals(1, sink.getContractViolations().size());
        assertThrows(IllegalStateException.class, () -> driver.start());
    }

    @Test
    void transitionExceptionIsFatalAndReported() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        StateTransition<ChannelState, ChannelChange, ChannelEvent> throwing = (s, c) -> {
            if (c instanceof ChannelChange.Withdraw) {
                throw new ArithmeticException("overflow");
            }
            return Iteration.unchanged(s);
        };
        driver = new SerializedDispatchDriver<>(manager(throwing, sink), events -> {}, sink, null);
        driver.start();

        driver.submit(new ChannelChange.Withdraw(1));
        awaitStopped(driver);

        assertInstanceOf(ArithmeticException.class, driver.failure().orElseThrow());
        assertTrue(sink.hasEventOfType(DispatchErrorEvent.class));
    }

    @Test
    void submitAfterAFatalDispatchIsRefused() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        driver = new SerializedDispatchDriver<>(manager((s, c) -> null, sink), events -> {}, sink, null);
        driver.start();

        driver.submit(new ChannelChange.Deposit(1));
        awaitStopped(driver);

        assertTrue(driver.failure().isPresent());
        assertFalse(driver.submit(new ChannelChange.Deposit(2)));
        assertEquals(Optional.of(new ChannelState.Open("ch-1", 0, 0)), driver.currentState());
    }

    @Test
    void interruptingTheLoopThreadStopsTheDriver() throws InterruptedException {
        AtomicReference<Thread> loop = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);
        driver = new SerializedDispatchDriver<>(manager(new ChannelTransition(), new RecordingObservabilitySink()),
                events -> {
                    loop.set(Thread.currentThread());
                    handled.countDown();
                });
        driver.start();

        assertTrue(driver.submit(new ChannelChange.Deposit(4)));
        assertTrue(handled.await(2, TimeUnit.SECONDS));

        loop.get().interrupt();
        awaitStopped(driver);

        assertFalse(driver.isRunning());
        assertTrue(driver.failure().isEmpty());
        assertFalse(driver.submit(new ChannelChange.Deposit(5)));
        assertEquals(Optional.of(new ChannelState.Open("ch-1", 4, 1)), driver.currentState());
    }
}
