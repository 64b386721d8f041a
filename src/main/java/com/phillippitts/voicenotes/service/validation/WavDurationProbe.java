package com.phillippitts.voicenotes.service.validation;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads the duration of RIFF/WAVE audio from its header: {@code dataSize / byteRate}.
 *
 * <p>Walks the chunk list to find {@code fmt } and {@code data}, tolerating extra chunks and
 * extended fmt chunks. Compressed containers (webm, mp4, mpeg) are not decoded; the probe
 * returns empty for them.
 */
@Component
public class WavDurationProbe implements AudioDurationProbe {

    @Override
    public Optional<Double> probe(byte[] bytes, String mimeType) {
        if (bytes == null || !isWav(bytes)) {
            return Optional.empty();
        }

        int offset = WavFormat.RIFF_HEADER_SIZE;
        int byteRate = -1;
        long dataSize = -1;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= bytes.length) {
            String chunkId = new String(bytes, offset, 4, StandardCharsets.US_ASCII);
            long chunkSize = readLEInt(bytes, offset + 4) & 0xFFFFFFFFL;
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;

            if ("fmt ".equals(chunkId)) {
                if (chunkSize < WavFormat.FMT_CHUNK_MIN_SIZE || body + chunkSize > bytes.length) {
                    throw new IllegalArgumentException("fmt chunk too small or truncated: " + chunkSize + " bytes");
                }
                byteRate = readLEInt(bytes, body + WavFormat.FMT_BYTE_RATE_OFFSET);
            } else if ("data".equals(chunkId)) {
                // streaming writers leave the size as 0 or 0xFFFFFFFF; use what is actually there
                long available = bytes.length - (long) body;
                dataSize = (chunkSize == 0 || chunkSize > available) ? available : chunkSize;
                break;
            }

            if (body + chunkSize > bytes.length) {
                throw new IllegalArgumentException("Invalid chunk size: " + chunkSize + " at offset " + offset);
            }
            offset = (int) (body + chunkSize + (chunkSize % 2));
        }

        if (byteRate <= 0) {
            throw new IllegalArgumentException("Missing or invalid fmt chunk in WAV file");
        }
        if (dataSize < 0) {
            throw new IllegalArgumentException("Missing data chunk in WAV file");
        }
        return Optional.of(dataSize / (double) byteRate);
    }

    private static boolean isWav(byte[] a) {
        return a.length >= WavFormat.RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
