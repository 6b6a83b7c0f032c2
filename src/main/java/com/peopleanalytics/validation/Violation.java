package com.peopleanalytics.validation;

public record Violation(
        String field,
        ViolationCode code,
        String message
) {
    public static Violation of(String field, ViolationCode code, String message) {
        return new Violation(field, code, message);
    }

    public ViolationCategory category() {
        return code.getCategory();
    }
}
