package io.patchbay.core.extract;

import java.io.Serial;

/// Thrown when a source unit does not contain a recognizable tool.
///
/// Fatal to that unit only. Common causes:
/// - No candidate method in the unit
/// - More than one candidate where exactly one was expected
/// - A candidate without a body, or with unbalanced delimiters
///
/// @see ToolModelExtractor#extract(String, String)
public class ToolExtractionException extends Exception {

    @Serial private static final long serialVersionUID = 4417203968122310547L;

    private final String unitId;

    /// Creates exception for a unit.
    ///
    /// @param unitId identifier of the offending unit, not null
    /// @param message description of why extraction failed
    public ToolExtractionException(String unitId, String message) {
        super(unitId + ": " + message);
        this.unitId = unitId;
    }

    /// Creates exception for a unit with a cause.
    ///
    /// @param unitId identifier of the offending unit, not null
    /// @param message description of why extraction failed
    /// @param cause the underlying exception
    public ToolExtractionException(String unitId, String message, Throwable cause) {
        super(unitId + ": " + message, cause);
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }
}
