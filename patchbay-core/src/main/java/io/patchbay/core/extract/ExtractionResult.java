package io.patchbay.core.extract;

import io.patchbay.core.model.ToolDefinition;
import java.util.Objects;

/// Outcome of extracting one candidate from a source unit.
///
/// A failed candidate does not stop its neighbours from being extracted.
public sealed interface ExtractionResult
        permits ExtractionResult.Extracted, ExtractionResult.Failed {

    /// The candidate produced a definition.
    ///
    /// @param definition extracted definition, not null
    record Extracted(ToolDefinition definition) implements ExtractionResult {
        public Extracted {
            Objects.requireNonNull(definition, "definition must not be null");
        }
    }

    /// The candidate could not be read.
    ///
    /// @param error the reason, naming the unit, not null
    record Failed(ToolExtractionException error) implements ExtractionResult {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
