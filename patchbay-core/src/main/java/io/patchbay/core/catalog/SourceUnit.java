package io.patchbay.core.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// One named piece of source text, typically a file.
///
/// @param unitId identifier used in locations and diagnostics, not null
/// @param source the text, not null
public record SourceUnit(String unitId, String source) {

    public SourceUnit {
        Objects.requireNonNull(unitId, "unitId must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /// Reads a file; the unit id is the file name.
    ///
    /// @throws IOException if the file cannot be read
    public static SourceUnit read(Path file) throws IOException {
        return new SourceUnit(file.getFileName().toString(), Files.readString(file));
    }
}
