package com.phillippitts.voicenotes.config.credential;

import com.phillippitts.voicenotes.config.properties.CredentialProperties;
import com.phillippitts.voicenotes.config.properties.StorageProperties;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.credential.CredentialSource;
import com.phillippitts.voicenotes.service.credential.EnvironmentCredentialSource;
import com.phillippitts.voicenotes.service.credential.LocalPreferenceCredentialSource;
import com.phillippitts.voicenotes.service.credential.SecureStoreCredentialSource;
import com.phillippitts.voicenotes.service.crypto.EncryptionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the credential lookup chain in the order given by {@code voicenotes.credentials.sources}.
 */
@Configuration
public class CredentialConfig {

    private final CredentialProperties props;
    private final StorageProperties storage;

    public CredentialConfig(CredentialProperties props, StorageProperties storage) {
        this.props = props;
        this.storage = storage;
    }

    @Bean
    public SecureStoreCredentialSource secureStoreCredentialSource(EncryptionService encryptionService) {
        return new SecureStoreCredentialSource(storage.resolve(props.getSecureDir()), props.getKeyName(),
                encryptionService);
    }

    @Bean
    public CredentialResolver credentialResolver(SecureStoreCredentialSource secureStore) {
        List<CredentialSource> chain = new ArrayList<>();
        for (CredentialProperties.SourceType type : props.getSources()) {
            chain.add(switch (type) {
                case SECURE_STORE -> secureStore;
                case LOCAL_PREFERENCES -> new LocalPreferenceCredentialSource(
                        storage.resolve(props.getLocalPreferencesFile()), props.getKeyName());
                case ENVIRONMENT -> new EnvironmentCredentialSource(props.getEnvironmentVariable());
            });
        }
        return new CredentialResolver(chain);
    }
}
