package com.podium.application.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link ConfigValidator}. Errors block startup, warnings are only reported.
 */
public final class ConfigValidationResult {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void addError(String message) {
        errors.add(message);
    }

    void addWarning(String message) {
        warnings.add(message);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    /** Errors joined on one line, for exception messages. */
    public String summary() {
        return String.join("; ", errors);
    }
}
