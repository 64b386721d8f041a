package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * On-disk locations for the failed-recording queue and the encryption master key.
 */
@ConfigurationProperties(prefix = "voicenotes.storage")
@Validated
public class StorageProperties {

    @NotBlank
    private String dataDir = System.getProperty("user.home") + "/.voicenotes";

    @NotBlank
    private String failedRecordingsFile = "voice-assistant-failed-recordings";

    @NotBlank
    private String masterKeyFile = "voice-assistant-encryption-key";

    /** PBKDF2 iterations used to derive a per-blob key from the master key. */
    @Positive
    private int keyDerivationIterations = 100_000;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getFailedRecordingsFile() {
        return failedRecordingsFile;
    }

    public void setFailedRecordingsFile(String failedRecordingsFile) {
        this.failedRecordingsFile = failedRecordingsFile;
    }

    public String getMasterKeyFile() {
        return masterKeyFile;
    }

    public void setMasterKeyFile(String masterKeyFile) {
        this.masterKeyFile = masterKeyFile;
    }

    public int getKeyDerivationIterations() {
        return keyDerivationIterations;
    }

    public void setKeyDerivationIterations(int keyDerivationIterations) {
        this.keyDerivationIterations = keyDerivationIterations;
    }

    /** Resolves a possibly-relative location against {@link #getDataDir()}. */
    public Path resolve(String location) {
        Path path = Path.of(location);
        return path.isAbsolute() ? path : Path.of(dataDir).resolve(path);
    }
}
