package com.phillippitts.voicenotes.service.credential;

import com.phillippitts.voicenotes.exception.CredentialMissingException;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the API key from an ordered chain of {@link CredentialSource}s.
 *
 * <p>Tries each source in order and returns the first non-empty value. A source that fails
 * to read is logged and skipped. When every source is empty the caller gets a terminal
 * {@link CredentialMissingException}. Nothing is cached: a key changed in Settings is picked
 * up by the next call.
 */
public class CredentialResolver {

    private static final Logger LOG = LogManager.getLogger(CredentialResolver.class);

    private final List<CredentialSource> sources;

    public CredentialResolver(List<CredentialSource> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one credential source is required");
        }
        this.sources = List.copyOf(sources);
        LOG.info("Credential sources (in order): {}", sources.stream().map(CredentialSource::name).toList());
    }

    /**
     * @throws CredentialMissingException if no source yields a key
     */
    public Credential resolve() {
        for (CredentialSource source : sources) {
            Optional<String> value;
            try {
                value = source.lookup();
            } catch (RuntimeException e) {
                LOG.warn("Credential source '{}' could not be read, trying next: {}",
                        source.name(), ErrorSanitizer.describe(e));
                continue;
            }
            if (value.isPresent()) {
                LOG.debug("Resolved API key from '{}'", source.name());
                return new Credential(value.get(), source.name());
            }
        }
        throw new CredentialMissingException();
    }

    /** Whether any source currently yields a key. */
    public boolean isConfigured() {
        try {
            resolve();
            return true;
        } catch (CredentialMissingException e) {
            return false;
        }
    }

    public List<CredentialSource> getSources() {
        return sources;
    }
}
