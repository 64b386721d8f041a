package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the API key is looked up, and in which order.
 */
@ConfigurationProperties(prefix = "voicenotes.credentials")
@Validated
public class CredentialProperties {

    public enum SourceType { SECURE_STORE, LOCAL_PREFERENCES, ENVIRONMENT }

    /** Key name used by the secure store and the local preference file. */
    @NotBlank
    private String keyName = "openai_api_key";

    /** Lookup order; the first non-empty value wins. */
    @NotEmpty
    private List<SourceType> sources = new ArrayList<>(List.of(
            SourceType.SECURE_STORE, SourceType.LOCAL_PREFERENCES, SourceType.ENVIRONMENT));

    /** Directory holding encrypted secrets; relative paths resolve against the data dir. */
    @NotBlank
    private String secureDir = "secure";

    /** Plain preference file; relative paths resolve against the data dir. */
    @NotBlank
    private String localPreferencesFile = "preferences.properties";

    @NotBlank
    private String environmentVariable = "OPENAI_API_KEY";

    public String getKeyName() {
        return keyName;
    }

    public void setKeyName(String keyName) {
        this.keyName = keyName;
    }

    public List<SourceType> getSources() {
        return sources;
    }

    public void setSources(List<SourceType> sources) {
        this.sources = sources;
    }

    public String getSecureDir() {
        return secureDir;
    }

    public void setSecureDir(String secureDir) {
        this.secureDir = secureDir;
    }

    public String getLocalPreferencesFile() {
        return localPreferencesFile;
    }

    public void setLocalPreferencesFile(String localPreferencesFile) {
        this.localPreferencesFile = localPreferencesFile;
    }

    public String getEnvironmentVariable() {
        return environmentVariable;
    }

    public void setEnvironmentVariable(String environmentVariable) {
        this.environmentVariable = environmentVariable;
    }
}
