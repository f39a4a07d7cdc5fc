package com.docassets.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating one asset file. Ordinary failures are collected here
 * rather than thrown.
 */
public class ValidationResult {
    private boolean valid = true;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private String sanitizedPath;

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * Records an error. Any error makes the result invalid.
     */
    public void addError(String error) {
        this.valid = false;
        this.errors.add(error);
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public String getSanitizedPath() {
        return sanitizedPath;
    }

    public void setSanitizedPath(String sanitizedPath) {
        this.sanitizedPath = sanitizedPath;
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
