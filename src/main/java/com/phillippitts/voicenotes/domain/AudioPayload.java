package com.phillippitts.voicenotes.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A finished recording handed to the pipeline.
 *
 * <p>{@code bytes} may be {@code null} or empty here; rejecting such payloads is the
 * validator's job, not the constructor's. The array is copied on the way in and out, and
 * equality compares its contents.
 *
 * @param bytes           encoded audio bytes
 * @param mimeType        declared MIME type (e.g. {@code audio/webm;codecs=opus}), may be null
 * @param durationSeconds duration reported by the recorder, or {@code null} if unknown
 * @param createdAt       capture time
 */
public record AudioPayload(byte[] bytes, String mimeType, Double durationSeconds, Instant createdAt) {

    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    public AudioPayload {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        bytes = bytes == null ? null : bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes == null ? null : bytes.clone();
    }

    public static AudioPayload of(byte[] bytes, String mimeType, Instant createdAt) {
        return new AudioPayload(bytes, mimeType, null, createdAt);
    }

    public long sizeBytes() {
        return bytes == null ? 0L : bytes.length;
    }

    /**
     * Encodes the payload as a {@code data:<mime>;base64,<bytes>} URL for storage and playback.
     */
    public String toDataUrl() {
        String mime = mimeType == null ? "application/octet-stream" : mimeType;
        byte[] data = bytes == null ? new byte[0] : bytes;
        return DATA_PREFIX + mime + BASE64_MARKER + Base64.getEncoder().encodeToString(data);
    }

    /**
     * Decodes a data URL produced by {@link #toDataUrl()}.
     *
     * @throws IllegalArgumentException if the value is not a base64 data URL
     */
    public static AudioPayload fromDataUrl(String dataUrl, Instant createdAt) {
        if (dataUrl == null || !dataUrl.startsWith(DATA_PREFIX)) {
            throw new IllegalArgumentException("Not a data URL");
        }
        int marker = dataUrl.indexOf(BASE64_MARKER);
        if (marker < 0) {
            throw new IllegalArgumentException("Data URL is not base64-encoded");
        }
        String mime = dataUrl.substring(DATA_PREFIX.length(), marker);
        byte[] bytes = Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()));
        return new AudioPayload(bytes, mime.isEmpty() ? null : mime, null, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioPayload other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes)
                && Objects.equals(mimeType, other.mimeType)
                && Objects.equals(durationSeconds, other.durationSeconds)
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(mimeType, durationSeconds, createdAt) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "AudioPayload[sizeBytes=" + sizeBytes() + ", mimeType=" + mimeType
                + ", durationSeconds=" + durationSeconds + ", createdAt=" + createdAt + "]";
    }
}
