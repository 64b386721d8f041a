package com.phillippitts.voicenotes.service.credential;

import com.phillippitts.voicenotes.exception.EncryptionException;
import com.phillippitts.voicenotes.service.crypto.EncryptionService;
import com.phillippitts.voicenotes.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Platform secure-store analogue: one owner-only file per key under the secure directory,
 * holding the value encrypted with the application's master key.
 */
public class SecureStoreCredentialSource implements CredentialSource {

    private static final Logger LOG = LogManager.getLogger(SecureStoreCredentialSource.class);

    private final Path file;
    private final EncryptionService encryption;

    public SecureStoreCredentialSource(Path secureDir, String keyName, EncryptionService encryption) {
        Objects.requireNonNull(secureDir, "secureDir must not be null");
        Objects.requireNonNull(keyName, "keyName must not be null");
        this.file = secureDir.resolve(keyName);
        this.encryption = Objects.requireNonNull(encryption, "encryption must not be null");
    }

    /**
     * @throws UncheckedIOException if the file exists but cannot be read
     * @throws EncryptionException  if the stored value cannot be decrypted
     */
    @Override
    public Optional<String> lookup() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String stored = Files.readString(file, StandardCharsets.UTF_8);
            if (stored.isBlank()) {
                return Optional.empty();
            }
            String value = encryption.decrypt(stored);
            return value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read secure store", e);
        }
    }

    /**
     * Stores the key, replacing any previous value.
     */
    public void store(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        try {
            AtomicFiles.writeString(file, encryption.encrypt(value.trim()), true);
            LOG.info("Stored API key in secure store");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write secure store", e);
        }
    }

    /**
     * Removes the stored key.
     *
     * @return {@code true} if a key was removed
     */
    public boolean clear() {
        try {
            boolean removed = Files.deleteIfExists(file);
            if (removed) {
                LOG.info("Removed API key from secure store");
            }
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear secure store", e);
        }
    }

    @Override
    public String name() {
        return "secure-store";
    }
}
