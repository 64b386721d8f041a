package com.phillippitts.voicenotes.service.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one pipeline run.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → VALIDATING → RATE_GATE_TRANSCRIPTION → TRANSCRIBING
 *      → RATE_GATE_EXTRACTION → EXTRACTING → SUCCEEDED
 * VALIDATING → RATE_GATE_EXTRACTION        (transcript already known)
 * any non-terminal → FAILED
 * IDLE, VALIDATING → CANCELLED
 * </pre>
 *
 * <p>Illegal transitions throw {@link IllegalStateException}.
 */
public final class PipelineStateMachine {

    private static final Map<PipelineState, Set<PipelineState>> ALLOWED = new EnumMap<>(PipelineState.class);

    static {
        ALLOWED.put(PipelineState.IDLE, EnumSet.of(PipelineState.VALIDATING, PipelineState.CANCELLED));
        ALLOWED.put(PipelineState.VALIDATING, EnumSet.of(PipelineState.RATE_GATE_TRANSCRIPTION,
                PipelineState.RATE_GATE_EXTRACTION, PipelineState.CANCELLED));
        ALLOWED.put(PipelineState.RATE_GATE_TRANSCRIPTION, EnumSet.of(PipelineState.TRANSCRIBING));
        ALLOWED.put(PipelineState.TRANSCRIBING, EnumSet.of(PipelineState.RATE_GATE_EXTRACTION));
        ALLOWED.put(PipelineState.RATE_GATE_EXTRACTION, EnumSet.of(PipelineState.EXTRACTING));
        ALLOWED.put(PipelineState.EXTRACTING, EnumSet.of(PipelineState.SUCCEEDED));
        for (PipelineState state : PipelineState.values()) {
            if (!state.isTerminal()) {
                ALLOWED.get(state).add(PipelineState.FAILED);
            } else {
                ALLOWED.put(state, EnumSet.noneOf(PipelineState.class));
            }
        }
    }

    private final Lock lock = new ReentrantLock();
    private final List<PipelineState> history = new ArrayList<>();
    private PipelineState current = PipelineState.IDLE;

    public PipelineStateMachine() {
        history.add(PipelineState.IDLE);
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transitionTo(PipelineState next) {
        lock.lock();
        try {
            if (!ALLOWED.get(current).contains(next)) {
                throw new IllegalStateException("Illegal pipeline transition " + current + " -> " + next);
            }
            current = next;
            history.add(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to CANCELLED if still before the first rate gate.
     *
     * @return {@code true} if the run is now cancelled
     */
    public boolean tryCancel() {
        lock.lock();
        try {
            if (current == PipelineState.CANCELLED) {
                return true;
            }
            if (!ALLOWED.get(current).contains(PipelineState.CANCELLED)) {
                return false;
            }
            current = PipelineState.CANCELLED;
            history.add(PipelineState.CANCELLED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PipelineState getState() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /** States visited so far, starting with IDLE. */
    public List<PipelineState> getHistory() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public static boolean isAllowed(PipelineState from, PipelineState to) {
        return ALLOWED.get(from).contains(to);
    }
}
