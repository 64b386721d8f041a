package com.phillippitts.voicenotes.config.storage;

import com.phillippitts.voicenotes.config.properties.StorageProperties;
import com.phillippitts.voicenotes.service.crypto.AesGcmEncryptionService;
import com.phillippitts.voicenotes.service.crypto.EncryptionService;
import com.phillippitts.voicenotes.service.crypto.MasterKeyFile;
import com.phillippitts.voicenotes.service.failed.EncryptedFileFailedRecordingStore;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Local encrypted storage: the master key and the failed-recording queue.
 */
@Configuration
public class StorageConfig {

    private static final Logger LOG = LogManager.getLogger(StorageConfig.class);

    private final StorageProperties props;

    public StorageConfig(StorageProperties props) {
        this.props = props;
    }

    @Bean
    public EncryptionService encryptionService() {
        Path keyFile = props.resolve(props.getMasterKeyFile());
        byte[] masterKey = MasterKeyFile.loadOrCreate(keyFile);
        return new AesGcmEncryptionService(masterKey, props.getKeyDerivationIterations());
    }

    @Bean
    public FailedRecordingStore failedRecordingStore(EncryptionService encryptionService) {
        Path file = props.resolve(props.getFailedRecordingsFile());
        LOG.info("Failed-recording queue at data dir {}", props.getDataDir());
        return new EncryptedFileFailedRecordingStore(file, encryptionService);
    }
}
