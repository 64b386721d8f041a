package com.phillippitts.voicenotes.service.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateMachineTest {

    @Test
    void startsIdle() {
        PipelineStateMachine sm = new PipelineStateMachine();

        assertThat(sm.getState()).isEqualTo(PipelineState.IDLE);
        assertThat(sm.getHistory()).containsExactly(PipelineState.IDLE);
    }

    @Test
    void rejectsSkippingTheRateGate() {
        PipelineStateMachine sm = new PipelineStateMachine();
        sm.transitionTo(PipelineState.VALIDATING);

        assertThatThrownBy(() -> sm.transitionTo(PipelineState.TRANSCRIBING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Illegal pipeline transition VALIDATING -> TRANSCRIBING");
        assertThat(sm.getState()).isEqualTo(PipelineState.VALIDATING);
    }

    @ParameterizedTest
    @EnumSource(value = PipelineState.class, names = {"SUCCEEDED", "FAILED", "CANCELLED"})
    void terminalStatesAreFinal(PipelineState terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (PipelineState next : PipelineState.values()) {
            assertThat(PipelineStateMachine.isAllowed(terminal, next)).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(value = PipelineState.class, names = {"SUCCEEDED", "FAILED", "CANCELLED"},
            mode = EnumSource.Mode.EXCLUDE)
    void everyActiveStateMayFail(PipelineState state) {
        assertThat(PipelineStateMachine.isAllowed(state, PipelineState.FAILED)).isTrue();
    }

    @Test
    void cancelOnlyBeforeFirstGate() {
        PipelineStateMachine early = new PipelineStateMachine();
        early.transitionTo(PipelineState.VALIDATING);
        assertThat(early.tryCancel()).isTrue();
        assertThat(early.tryCancel()).isTrue();
        assertThat(early.getHistory()).containsExactly(
                PipelineState.IDLE, PipelineState.VALIDATING, PipelineState.CANCELLED);

        PipelineStateMachine late = new PipelineStateMachine();
        late.transitionTo(PipelineState.VALIDATING);
        late.transitionTo(PipelineState.RATE_GATE_TRANSCRIPTION);
        assertThat(late.tryCancel()).isFalse();
        assertThat(late.getState()).isEqualTo(PipelineState.RATE_GATE_TRANSCRIPTION);
    }

    @Test
    void concurrentTerminalTransitionsHaveOneWinner() throws Exception {
        PipelineStateMachine sm = new PipelineStateMachine();
        sm.transitionTo(PipelineState.VALIDATING);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                boolean cancel = i % 2 == 0;
                attempts.add(pool.submit(() -> {
                    start.await();
                    if (cancel) {
                        return sm.tryCancel() && sm.getState() == PipelineState.CANCELLED;
                    }
                    try {
                        sm.transitionTo(PipelineState.FAILED);
                        return true;
                    } catch (IllegalStateException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            for (Future<Boolean> attempt : attempts) {
                attempt.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(sm.getState().isTerminal()).isTrue();
        assertThat(sm.getHistory()).hasSize(3);
    }

    @Test
    void runCancelReportsWhetherStopWillTakeEffect() {
        PipelineRun run = new PipelineRun();
        assertThat(run.cancel()).isTrue();
        assertThat(run.isCancelRequested()).isTrue();

        PipelineRun started = new PipelineRun();
        started.stateMachine().transitionTo(PipelineState.VALIDATING);
        started.stateMachine().transitionTo(PipelineState.RATE_GATE_EXTRACTION);
        assertThat(started.cancel()).isFalse();
    }
}
