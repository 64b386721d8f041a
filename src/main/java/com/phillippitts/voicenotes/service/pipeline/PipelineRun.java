package com.phillippitts.voicenotes.service.pipeline;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one pipeline run: its id, its state machine, and a user stop request.
 *
 * <p>A stop only takes effect before the first rate gate. Once a provider call has been
 * admitted the run continues to a terminal state.
 */
public final class PipelineRun {

    private final UUID id;
    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public PipelineRun() {
        this(UUID.randomUUID());
    }

    public PipelineRun(UUID id) {
        if (id == null) {
            throw new NullPointerException("id cannot be null");
        }
        this.id = id;
    }

    public UUID getId() {
        return id;
    }

    public PipelineState getState() {
        return stateMachine.getState();
    }

    PipelineStateMachine stateMachine() {
        return stateMachine;
    }

    /**
     * Requests a stop.
     *
     * @return {@code true} if the run has not yet reached a rate gate, so the stop will take effect
     */
    public boolean cancel() {
        cancelRequested.set(true);
        PipelineState state = stateMachine.getState();
        return state == PipelineState.IDLE || state == PipelineState.VALIDATING || state == PipelineState.CANCELLED;
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
