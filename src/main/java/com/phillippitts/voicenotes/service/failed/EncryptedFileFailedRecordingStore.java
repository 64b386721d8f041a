package com.phillippitts.voicenotes.service.failed;

import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.exception.EncryptionException;
import com.phillippitts.voicenotes.exception.StorageException;
import com.phillippitts.voicenotes.service.crypto.EncryptionService;
import com.phillippitts.voicenotes.util.AtomicFiles;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link FailedRecordingStore} holding the whole collection as one encrypted file.
 *
 * <p>Every read decrypts the file; every write re-encrypts the full collection and replaces
 * the file atomically. A file that does not decrypt but parses as a JSON array is a legacy
 * plaintext store: it is returned and immediately rewritten encrypted. Content that is
 * neither reads as empty; a copy is kept next to the file before it can be overwritten.
 *
 * <p>Array entries that do not parse as a recording are hidden from callers but written back
 * unchanged on every write, so their audio is never dropped.
 *
 * <p>Thread-safe: all operations are {@code synchronized} so concurrent replays cannot lose
 * each other's updates.
 */
public class EncryptedFileFailedRecordingStore implements FailedRecordingStore {

    private static final Logger LOG = LogManager.getLogger(EncryptedFileFailedRecordingStore.class);

    private final Path file;
    private final EncryptionService encryption;

    public EncryptedFileFailedRecordingStore(Path file, EncryptionService encryption) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.encryption = Objects.requireNonNull(encryption, "encryption must not be null");
    }

    @Override
    public synchronized List<FailedRecording> list() {
        return load().recordings();
    }

    @Override
    public synchronized void save(FailedRecording recording) {
        Objects.requireNonNull(recording, "recording must not be null");
        FailedRecordingJson.Stored stored = load();
        List<FailedRecording> all = new ArrayList<>(stored.recordings());
        int existing = indexOf(all, recording.id());
        if (existing >= 0) {
            all.set(existing, recording);
        } else {
            all.add(0, recording);
        }
        persist(stored.withRecordings(all));
        LOG.info("Saved failed recording id={} type={} retryCount={}", recording.id(),
                recording.errorType().wireName(), recording.retryCount());
    }

    @Override
    public synchronized boolean update(FailedRecording recording) {
        Objects.requireNonNull(recording, "recording must not be null");
        FailedRecordingJson.Stored stored = load();
        List<FailedRecording> all = new ArrayList<>(stored.recordings());
        int existing = indexOf(all, recording.id());
        if (existing < 0) {
            return false;
        }
        all.set(existing, recording);
        persist(stored.withRecordings(all));
        LOG.info("Updated failed recording id={} retryCount={}", recording.id(), recording.retryCount());
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        FailedRecordingJson.Stored stored = load();
        List<FailedRecording> all = new ArrayList<>(stored.recordings());
        int index = indexOf(all, id);
        if (index < 0) {
            return false;
        }
        all.remove(index);
        persist(stored.withRecordings(all));
        LOG.info("Deleted failed recording id={}", id);
        return true;
    }

    @Override
    public synchronized int count() {
        return load().recordings().size();
    }

    @Override
    public synchronized Optional<FailedRecording> getById(String id) {
        return load().recordings().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
            LOG.info("Cleared all failed recordings");
        } catch (IOException e) {
            throw new StorageException("Failed to clear failed recordings", e);
        }
    }

    private FailedRecordingJson.Stored load() {
        String stored;
        try {
            if (!Files.exists(file)) {
                return FailedRecordingJson.Stored.EMPTY;
            }
            stored = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read failed recordings", e);
        }
        if (stored.isBlank()) {
            return FailedRecordingJson.Stored.EMPTY;
        }

        try {
            return FailedRecordingJson.read(encryption.decrypt(stored));
        } catch (EncryptionException decryptFailure) {
            return migrateLegacyPlaintext(stored, decryptFailure);
        } catch (JSONException e) {
            LOG.error("Decrypted failed recordings are not a JSON array: {}", ErrorSanitizer.describe(e));
            keepCorruptCopy();
            return FailedRecordingJson.Stored.EMPTY;
        }
    }

    private FailedRecordingJson.Stored migrateLegacyPlaintext(String stored, EncryptionException decryptFailure) {
        FailedRecordingJson.Stored legacy;
        try {
            legacy = FailedRecordingJson.read(stored);
        } catch (JSONException parseFailure) {
            LOG.error("Failed recordings could not be decrypted or parsed: {}",
                    ErrorSanitizer.describe(decryptFailure));
            keepCorruptCopy();
            return FailedRecordingJson.Stored.EMPTY;
        }
        LOG.warn("Migrating {} failed recordings from legacy plaintext storage", legacy.recordings().size());
        persist(legacy);
        return legacy;
    }

    private void persist(FailedRecordingJson.Stored stored) {
        try {
            AtomicFiles.writeString(file, encryption.encrypt(FailedRecordingJson.write(stored)), true);
        } catch (IOException e) {
            throw new StorageException("Failed to write failed recordings", e);
        }
    }

    private void keepCorruptCopy() {
        Path backup = file.resolveSibling(file.getFileName() + ".corrupt");
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            LOG.warn("Kept unreadable failed-recordings file as {}", backup.getFileName());
        } catch (IOException e) {
            LOG.error("Could not back up unreadable failed-recordings file: {}", ErrorSanitizer.describe(e));
        }
    }

    private static int indexOf(List<FailedRecording> all, String id) {
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
