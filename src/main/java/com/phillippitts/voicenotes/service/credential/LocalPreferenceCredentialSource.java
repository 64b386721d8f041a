package com.phillippitts.voicenotes.service.credential;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Locally persisted, unencrypted preference value: a {@code .properties} file keyed by the
 * credential key name.
 */
public class LocalPreferenceCredentialSource implements CredentialSource {

    private final Path file;
    private final String keyName;

    public LocalPreferenceCredentialSource(Path file, String keyName) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.keyName = Objects.requireNonNull(keyName, "keyName must not be null");
    }

    @Override
    public Optional<String> lookup() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read local preferences", e);
        }
        String value = props.getProperty(keyName);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    @Override
    public String name() {
        return "local-preferences";
    }
}
