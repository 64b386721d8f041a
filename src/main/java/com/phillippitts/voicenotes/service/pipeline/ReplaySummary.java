package com.phillippitts.voicenotes.service.pipeline;

/**
 * Counts from one replay sweep over the failed-recording queue.
 *
 * @param attempted entries replayed
 * @param succeeded entries that produced an item and were removed
 * @param failed    entries that failed again and were updated in place
 * @param rejected  entries left untouched because the run was refused
 * @param remaining queue size after the sweep
 */
public record ReplaySummary(int attempted, int succeeded, int failed, int rejected, int remaining) {}
