package com.phillippitts.scalogram.service.orchestration;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle of one input file within a batch.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * PENDING → LOADED → TRANSFORMED → RENDERED → EMITTED
 * any non-terminal state → FAILED
 * </pre>
 * Any other transition throws {@link IllegalStateException}.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}.
 */
public final class FileStateMachine {

    /**
     * States of one file.
     */
    public enum State {
        PENDING,
        LOADED,
        TRANSFORMED,
        RENDERED,
        EMITTED,
        FAILED;

        public boolean isTerminal() {
            return this == EMITTED || this == FAILED;
        }

        State successor() {
            return switch (this) {
                case PENDING -> LOADED;
                case LOADED -> TRANSFORMED;
                case TRANSFORMED -> RENDERED;
                case RENDERED -> EMITTED;
                case EMITTED, FAILED -> null;
            };
        }
    }

    private final Lock lock = new ReentrantLock();
    private final String identifier;
    private State state = State.PENDING;

    public FileStateMachine(String identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
    }

    /**
     * Moves to the next state of the happy path.
     *
     * @param next expected next state
     * @throws IllegalStateException if {@code next} is not the successor of the current state
     */
    public void advance(State next) {
        lock.lock();
        try {
            if (state.successor() != next) {
                throw new IllegalStateException("Illegal transition for " + identifier + ": "
                        + state + " -> " + next);
            }
            state = next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the file as failed.
     *
     * @throws IllegalStateException if the file already reached a terminal state
     */
    public void fail() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                throw new IllegalStateException("Illegal transition for " + identifier + ": "
                        + state + " -> " + State.FAILED);
            }
            state = State.FAILED;
        } finally {
            lock.unlock();
        }
    }

    public State current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return current().isTerminal();
    }
}
