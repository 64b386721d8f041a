package com.phillippitts.voicenotes.service.failed;

import com.phillippitts.voicenotes.domain.FailedRecording;

import java.util.List;
import java.util.Optional;

/**
 * Durable queue of recordings whose pipeline run failed.
 */
public interface FailedRecordingStore {

    /** All entries, newest first. */
    List<FailedRecording> list();

    /**
     * Upserts by id: an existing entry is replaced in place, a new one is prepended.
     *
     * @throws com.phillippitts.voicenotes.exception.StorageException if the write fails
     */
    void save(FailedRecording recording);

    /**
     * Replaces an existing entry in place; does nothing if the id is no longer queued.
     *
     * @return {@code true} if an entry was replaced
     * @throws com.phillippitts.voicenotes.exception.StorageException if the write fails
     */
    boolean update(FailedRecording recording);

    /**
     * @return {@code true} if an entry was removed
     */
    boolean delete(String id);

    int count();

    Optional<FailedRecording> getById(String id);

    /** Removes every entry. */
    void clear();
}
