package com.phillippitts.voicenotes.domain;

/**
 * Facts gathered about an audio payload during validation.
 *
 * @param sizeBytes       payload size in bytes
 * @param mimeType        declared MIME type, or {@code null}
 * @param durationSeconds duration in seconds, or {@code null} when not determined
 */
public record AudioDetails(long sizeBytes, String mimeType, Double durationSeconds) {
}
