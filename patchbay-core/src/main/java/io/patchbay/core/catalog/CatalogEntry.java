package io.patchbay.core.catalog;

import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.ValidationReport;
import java.util.Objects;

/// One tool, or one unreadable tool, of a catalog.
public sealed interface CatalogEntry permits CatalogEntry.Validated, CatalogEntry.Unextractable {

    /// Whether this entry counts as a valid tool.
    boolean valid();

    /// Extracted and validated.
    ///
    /// @param definition the tool, not null
    /// @param report its verdicts, not null
    record Validated(ToolDefinition definition, ValidationReport report) implements CatalogEntry {
        public Validated {
            Objects.requireNonNull(definition, "definition must not be null");
            Objects.requireNonNull(report, "report must not be null");
        }

        @Override
        public boolean valid() {
            return report.overallPassed();
        }
    }

    /// Could not be extracted.
    ///
    /// @param unitId offending unit, not null
    /// @param message why extraction failed, not null
    record Unextractable(String unitId, String message) implements CatalogEntry {
        public Unextractable {
            Objects.requireNonNull(unitId, "unitId must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public boolean valid() {
            return false;
        }
    }
}
