package com.sweref.coordsearch.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class ValidationResult {
    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.valid = this.errors.isEmpty();
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(List.of(error), List.of());
    }
}
