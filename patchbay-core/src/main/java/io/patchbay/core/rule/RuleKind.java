package io.patchbay.core.rule;

public enum RuleKind {
    STRUCTURAL, // Derived from signature and body shape
    HEURISTIC // Derived from documentation prose
}
