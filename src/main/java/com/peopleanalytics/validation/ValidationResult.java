package com.peopleanalytics.validation;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a validation pass: either the accepted, normalized value or the list of
 * violations. Exactly one of the two is present.
 */
public final class ValidationResult<T> {

    private final T value;
    private final List<Violation> violations;

    private ValidationResult(T value, List<Violation> violations) {
        this.value = value;
        this.violations = violations;
    }

    public static <T> ValidationResult<T> accepted(T value) {
        return new ValidationResult<>(Objects.requireNonNull(value, "value"), List.of());
    }

    public static <T> ValidationResult<T> rejected(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("A rejected result needs at least one violation");
        }
        return new ValidationResult<>(null, List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public T getValue() {
        if (!isValid()) {
            throw new IllegalStateException("Rejected result has no value");
        }
        return value;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Re-types a rejected result so its violations can travel further up.
     */
    public <R> ValidationResult<R> asRejected() {
        if (isValid()) {
            throw new IllegalStateException("Accepted result cannot be re-typed as rejected");
        }
        return new ValidationResult<>(null, violations);
    }

    public boolean hasCategory(ViolationCategory category) {
        return violations.stream().anyMatch(v -> v.category() == category);
    }

    /**
     * Single-line description of all violations, used for row errors.
     */
    public String describe() {
        return describe(violations);
    }

    public static String describe(List<Violation> violations) {
        return violations.stream()
                .map(v -> v.field() + ": " + v.message())
                .collect(Collectors.joining("; "));
    }
}
