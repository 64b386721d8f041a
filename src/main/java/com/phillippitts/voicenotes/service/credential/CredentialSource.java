package com.phillippitts.voicenotes.service.credential;

import java.util.Optional;

/**
 * One place an API key may be configured. Sources are consulted in a fixed order by
 * {@link CredentialResolver}.
 */
public interface CredentialSource {

    /**
     * Reads the key.
     *
     * @return the key, or empty when this source has none
     * @throws RuntimeException when the source could not be read at all; the resolver logs it
     *         and moves on, which is not the same as "empty"
     */
    Optional<String> lookup();

    /** Short name for logs (e.g. "secure-store"). */
    String name();
}
