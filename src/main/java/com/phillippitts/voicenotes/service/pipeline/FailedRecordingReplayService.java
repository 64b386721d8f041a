package com.phillippitts.voicenotes.service.pipeline;

import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Replays queued recordings through the pipeline.
 *
 * <p>A sweep processes entries oldest first and stops at the first rate-limit refusal, since
 * every later entry would be refused by the same bucket.
 */
public class FailedRecordingReplayService {

    private static final Logger LOG = LogManager.getLogger(FailedRecordingReplayService.class);

    private final FailedRecordingStore store;
    private final PipelineOrchestrator orchestrator;

    public FailedRecordingReplayService(FailedRecordingStore store, PipelineOrchestrator orchestrator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    }

    /**
     * Replays one entry.
     *
     * @return the run result, or empty if no entry has that id
     */
    public Optional<PipelineResult> replay(String id) {
        return store.getById(id).map(entry -> orchestrator.replay(entry, new PipelineRun()));
    }

    public ReplaySummary replayAll() {
        List<FailedRecording> entries = new ArrayList<>(store.list());
        Collections.reverse(entries);

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        int rejected = 0;
        for (FailedRecording entry : entries) {
            attempted++;
            PipelineResult result = orchestrator.replay(entry, new PipelineRun());
            if (result instanceof PipelineResult.Succeeded) {
                succeeded++;
            } else if (result instanceof PipelineResult.Failed) {
                failed++;
            } else {
                rejected++;
                if (result instanceof PipelineResult.Rejected r && r.error().getKind() == ErrorKind.RATE_LIMIT) {
                    LOG.info("Replay sweep paused by rate limiter after {} of {} entries", attempted, entries.size());
                    break;
                }
            }
        }
        ReplaySummary summary = new ReplaySummary(attempted, succeeded, failed, rejected, store.count());
        LOG.info("Replay sweep finished: {}", summary);
        return summary;
    }
}
