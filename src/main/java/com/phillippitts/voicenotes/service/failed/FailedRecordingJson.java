package com.phillippitts.voicenotes.service.failed;

import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.FailedRecordingErrorType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the stored collection: an array of objects with ISO-8601 timestamps and
 * lower-case error types. Optional fields are omitted when absent.
 */
final class FailedRecordingJson {

    private static final Logger LOG = LogManager.getLogger(FailedRecordingJson.class);

    private FailedRecordingJson() {}

    /**
     * Serializes the readable entries followed by the unreadable ones exactly as they were read.
     */
    static String write(Stored stored) {
        JSONArray array = new JSONArray();
        for (FailedRecording r : stored.recordings()) {
            array.put(toJson(r));
        }
        for (Object raw : stored.unreadable()) {
            array.put(raw);
        }
        return array.toString();
    }

    /**
     * Parses a stored array. Entries that do not form a valid recording are logged and carried
     * along untouched in {@link Stored#unreadable()} so a later write does not drop them.
     *
     * @throws JSONException if the text is not a JSON array
     */
    static Stored read(String text) {
        JSONArray array = new JSONArray(text);
        List<FailedRecording> recordings = new ArrayList<>(array.length());
        List<Object> unreadable = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            Object raw = array.get(i);
            if (!(raw instanceof JSONObject obj)) {
                LOG.warn("Keeping non-object failed-recording entry at index {} as is", i);
                unreadable.add(raw);
                continue;
            }
            try {
                recordings.add(fromJson(obj));
            } catch (RuntimeException e) {
                LOG.warn("Keeping malformed failed-recording entry at index {} as is: {}", i,
                        e.getClass().getSimpleName());
                unreadable.add(obj);
            }
        }
        return new Stored(recordings, unreadable);
    }

    static JSONObject toJson(FailedRecording r) {
        JSONObject obj = new JSONObject()
                .put("id", r.id())
                .put("createdAt", r.createdAt().toString())
                .put("failedAt", r.failedAt().toString())
                .put("audioData", r.audioData())
                .put("errorMessage", r.errorMessage())
                .put("errorType", r.errorType().wireName())
                .put("retryCount", r.retryCount());
        if (r.transcript() != null) {
            obj.put("transcript", r.transcript());
        }
        if (r.detectedLanguage() != null) {
            obj.put("detectedLanguage", r.detectedLanguage());
        }
        if (r.lastRetryAt() != null) {
            obj.put("lastRetryAt", r.lastRetryAt().toString());
        }
        return obj;
    }

    static FailedRecording fromJson(JSONObject obj) {
        return new FailedRecording(
                obj.getString("id"),
                instant(obj.getString("createdAt")),
                instant(obj.getString("failedAt")),
                obj.getString("audioData"),
                optString(obj, "transcript"),
                optString(obj, "detectedLanguage"),
                obj.optString("errorMessage", "Unknown error"),
                FailedRecordingErrorType.fromWireName(optString(obj, "errorType")),
                Math.max(0, obj.optInt("retryCount", 0)),
                optString(obj, "lastRetryAt") == null ? null : instant(obj.getString("lastRetryAt")));
    }

    /**
     * Stored collection split into entries that parsed and raw entries that did not.
     */
    record Stored(List<FailedRecording> recordings, List<Object> unreadable) {

        static final Stored EMPTY = new Stored(List.of(), List.of());

        Stored {
            recordings = List.copyOf(recordings);
            unreadable = List.copyOf(unreadable);
        }

        Stored withRecordings(List<FailedRecording> updated) {
            return new Stored(updated, unreadable);
        }
    }

    private static String optString(JSONObject obj, String key) {
        return obj.has(key) && !obj.isNull(key) ? obj.getString(key) : null;
    }

    private static Instant instant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value, e);
        }
    }
}
