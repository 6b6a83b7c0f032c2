package com.peopleanalytics.validation;

/**
 * Broad class of a rule violation. Callers use it to pick a response: a plain rejection, a
 * conflict with existing data, or a dangling reference.
 */
public enum ViolationCategory {
    VALIDATION,
    CONFLICT,
    NOT_FOUND
}
