package io.patchbay.core.convention;

import io.patchbay.core.runtime.ToolResults;
import java.util.Set;
import java.util.regex.Pattern;

/// The fixed vocabulary of the tool convention.
///
/// Extractor, rules, generator and harness all read these constants; none of them
/// spells the vocabulary out on its own.
public final class ToolConventions {

    /// Canonical error prefix, shared with the runtime helpers.
    public static final String ERROR_PREFIX = ToolResults.ERROR_PREFIX;

    /// Simple name of the registration marker annotation.
    public static final String MARKER = "McpTool";

    /// Simple name of the optional-parameter annotation.
    public static final String PARAM_ANNOTATION = "Param";

    /// Simple name of the injected context type.
    public static final String CONTEXT_TYPE = "ToolContext";

    /// Message returned when a named handler is unavailable.
    public static final String HANDLER_UNAVAILABLE = ERROR_PREFIX + "Server not initialized";

    /// Message returned when the direct backend is unavailable.
    public static final String BACKEND_UNAVAILABLE = ERROR_PREFIX + "Server initialization failed";

    /// Return types accepted as asynchronously invocable.
    public static final Set<String> ASYNC_TYPES = Set.of("CompletableFuture", "CompletionStage");

    /// Annotation names that look like a tool marker even when not canonical.
    private static final Pattern MARKER_LIKE = Pattern.compile("(?i)(?:\\w+\\.)*(?:mcp)?_?tool");

    private static final Pattern SNAKE_CASE = Pattern.compile("[a-z][a-z0-9]*(?:_[a-z0-9]+)*");

    private ToolConventions() {}

    /// Returns whether an annotation name looks like a tool marker
    /// (`McpTool`, `Tool`, `mcp.tool`, `io.patchbay.core.runtime.McpTool`).
    ///
    /// @param annotationName annotation name without `@`, not null
    /// @return true if the name denotes a marker, canonical or not
    public static boolean isMarkerLike(String annotationName) {
        return MARKER_LIKE.matcher(annotationName).matches();
    }

    /// Returns whether a name is a lower snake_case identifier.
    public static boolean isSnakeCase(String name) {
        return name != null && SNAKE_CASE.matcher(name).matches();
    }

    /// Converts `setTempo` or `SetTempo` to `set_tempo`. Snake case input is returned unchanged.
    ///
    /// @param name identifier, not null
    /// @return snake_case form, never null
    public static String toSnakeCase(String name) {
        StringBuilder out = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean boundary =
                        i > 0
                                && name.charAt(i - 1) != '_'
                                && (Character.isLowerCase(name.charAt(i - 1))
                                        || Character.isDigit(name.charAt(i - 1))
                                        || (i + 1 < name.length()
                                                && Character.isLowerCase(name.charAt(i + 1))));
                if (boundary) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /// Converts `set_tempo` to `setTempo`. Names without underscores keep their first letter
    /// lower-cased and are otherwise unchanged.
    ///
    /// @param name identifier, not null
    /// @return lowerCamelCase form, never null
    public static String toCamelCase(String name) {
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = out.length() > 0;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(out.length() == 0 ? Character.toLowerCase(c) : c);
            }
        }
        return out.toString();
    }

    /// Returns whether a type name, with any generic arguments stripped, is an async type.
    ///
    /// @param rawType simple or qualified type name without generics, not null
    /// @return true for `CompletableFuture` and `CompletionStage`
    public static boolean isAsyncType(String rawType) {
        String simple = rawType.substring(rawType.lastIndexOf('.') + 1);
        return ASYNC_TYPES.contains(simple);
    }
}
