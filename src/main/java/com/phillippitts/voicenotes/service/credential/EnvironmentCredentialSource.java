package com.phillippitts.voicenotes.service.credential;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Environment variable lookup ({@code OPENAI_API_KEY} by default).
 */
public class EnvironmentCredentialSource implements CredentialSource {

    private final String variable;
    private final UnaryOperator<String> environment;

    public EnvironmentCredentialSource(String variable) {
        this(variable, System::getenv);
    }

    /**
     * @param environment variable lookup, replaceable in tests
     */
    public EnvironmentCredentialSource(String variable, UnaryOperator<String> environment) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public Optional<String> lookup() {
        String value = environment.apply(variable);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    @Override
    public String name() {
        return "environment";
    }
}
