package io.patchbay.core.harness;

/// How a tool invocation ended.
public enum OutcomeKind {
    SUCCESS, // Plain text without the error prefix
    ERROR_MESSAGE, // Text starting with the error prefix
    RAISED, // An exception escaped the tool
    HUNG, // No result within the case timeout
    SKIPPED // Case not applicable to the tool
}
