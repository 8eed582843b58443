package com.eainde.flowconverter.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of {@link ProgramValidator#validate}: valid when no check reported anything.
 */
public record ValidationResult(List<ValidationIssue> issues) {

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public boolean has(ValidationIssue.Check check) {
        return issues.stream().anyMatch(issue -> issue.check() == check);
    }

    public List<String> messages() {
        return issues.stream().map(ValidationIssue::toString).collect(Collectors.toList());
    }
}
