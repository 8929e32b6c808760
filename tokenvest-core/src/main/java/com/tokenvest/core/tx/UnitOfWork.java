package com.tokenvest.core.tx;

import com.tokenvest.core.event.VestingEventLog;
import com.tokenvest.core.event.VestingEventLog.VestingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * All-or-nothing execution of state transitions shared by the vesting engine and the
 * distribution ledger.
 *
 * <p>Operations are serialized on this instance. A nested {@link #execute} joins the outer unit,
 * so a claim and the disbursement it triggers commit or roll back together. Stores call
 * {@link #onRollback} before each write; on failure the undo actions run newest first and the
 * buffered events are discarded. Events reach the {@link VestingEventLog} only when the outermost
 * unit commits.
 */
public class UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final VestingEventLog eventLog;
    private Frame current;

    public UnitOfWork(VestingEventLog eventLog) {
        this.eventLog = Objects.requireNonNull(eventLog, "Event log cannot be null");
    }

    public synchronized <T> T execute(String operation, Supplier<T> work) {
        if (current != null) {
            return work.get();
        }
        Frame frame = new Frame(operation);
        current = frame;
        T result;
        try {
            result = work.get();
        } catch (RuntimeException | Error e) {
            current = null;
            frame.rollback(e);
            log.warn("Operation {} rolled back: {}", operation, e.getMessage());
            throw e;
        }
        current = null;
        for (VestingEvent event : frame.events) {
            eventLog.append(event);
        }
        log.debug("Operation {} committed with {} event(s)", operation, frame.events.size());
        return result;
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs a read under the same lock so no partially applied operation is observed.
     */
    public synchronized <T> T query(Supplier<T> read) {
        return read.get();
    }

    /**
     * Registers the inverse of a write about to happen in the active unit.
     */
    public void onRollback(Runnable undo) {
        requireActive().undo.push(Objects.requireNonNull(undo, "Undo action cannot be null"));
    }

    /**
     * Buffers an event for publication at commit.
     */
    public void emit(VestingEvent event) {
        requireActive().events.add(Objects.requireNonNull(event, "Event cannot be null"));
    }

    public synchronized boolean isActive() {
        return current != null;
    }

    private Frame requireActive() {
        if (current == null) {
            throw new IllegalStateException("No active unit of work");
        }
        return current;
    }

    private static final class Frame {
        private final String operation;
        private final Deque<Runnable> undo = new ArrayDeque<>();
        private final List<VestingEvent> events = new ArrayList<>();

        private Frame(String operation) {
            this.operation = operation;
        }

        private void rollback(Throwable cause) {
            while (!undo.isEmpty()) {
                try {
                    undo.pop().run();
                } catch (RuntimeException e) {
                    log.error("Undo step failed while rolling back {}", operation, e);
                    cause.addSuppressed(e);
                }
            }
            events.clear();
        }
    }
}
