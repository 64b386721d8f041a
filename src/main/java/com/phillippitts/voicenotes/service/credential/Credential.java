package com.phillippitts.voicenotes.service.credential;

import java.util.Objects;

/**
 * An API key. {@link #toString()} never prints the value.
 *
 * @param value  the secret
 * @param source name of the source it was read from
 */
public record Credential(String value, String source) {

    public Credential {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Credential value must not be blank");
        }
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", value=***]";
    }
}
