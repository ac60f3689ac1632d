package io.patchbay.core.harness;

/// Which check a test case performs.
public enum CaseKind {
    REGISTRATION,
    UNAVAILABLE_DEPENDENCY,
    HAPPY_PATH,
    DELEGATION_FAILURE,
    INVALID_PARAMETER,
    CUSTOM
}
