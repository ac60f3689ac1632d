package io.patchbay.core.catalog;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Validation results of a whole catalog, in declaration order.
///
/// @param entries one entry per tool candidate, in unit then declaration order
/// @param duplicateNames tool names declared more than once
public record CatalogReport(List<CatalogEntry> entries, Set<String> duplicateNames) {

    public CatalogReport {
        entries = entries != null ? List.copyOf(entries) : List.of();
        duplicateNames =
                duplicateNames != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(duplicateNames))
                        : Set.of();
    }

    public int total() {
        return entries.size();
    }

    public long validCount() {
        return entries.stream().filter(CatalogEntry::valid).count();
    }

    public long invalidCount() {
        return total() - validCount();
    }

    /// Whether every tool is valid and every name unique.
    public boolean allPassed() {
        return invalidCount() == 0 && duplicateNames.isEmpty();
    }
}
