package com.phillippitts.voicenotes.service.crypto;

import com.phillippitts.voicenotes.exception.EncryptionException;
import com.phillippitts.voicenotes.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Loads the 256-bit master key from a file, generating and persisting it on first use.
 * The file holds the key base64-encoded and is restricted to the owner where the file
 * system supports POSIX permissions.
 */
public final class MasterKeyFile {

    private static final Logger LOG = LogManager.getLogger(MasterKeyFile.class);

    static final int KEY_LENGTH_BYTES = 32;

    private MasterKeyFile() {}

    /**
     * Returns the key stored at {@code path}, creating it if the file does not exist.
     *
     * @throws EncryptionException if the file exists but holds no usable key, or cannot be written
     */
    public static byte[] loadOrCreate(Path path) {
        try {
            if (Files.exists(path)) {
                byte[] key = Base64.getDecoder().decode(Files.readString(path, StandardCharsets.UTF_8).trim());
                if (key.length != KEY_LENGTH_BYTES) {
                    throw new EncryptionException("Master key has invalid length: " + key.length);
                }
                return key;
            }
            byte[] key = new byte[KEY_LENGTH_BYTES];
            new SecureRandom().nextBytes(key);
            AtomicFiles.writeString(path, Base64.getEncoder().encodeToString(key), true);
            LOG.info("Generated new encryption master key");
            return key;
        } catch (IOException | IllegalArgumentException e) {
            throw new EncryptionException("Encryption key initialization failed", e);
        }
    }
}
