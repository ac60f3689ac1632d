package io.patchbay.core.runtime;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/// Result helpers shared by hand-written and generated tools.
public final class ToolResults {

    /// Prefix every failure-path result starts with.
    public static final String ERROR_PREFIX = "Error: ";

    private ToolResults() {}

    /// Unwraps the first textual field of a delegation result.
    ///
    /// Resolution order:
    /// 1. a `String` result is returned as is
    /// 2. a `List` whose first element is a `Map` with a `"text"` entry yields that entry
    /// 3. a `Map` with a `"message"` or `"text"` entry yields that entry
    /// 4. anything else (including `null`) yields `fallback`
    ///
    /// @param result raw delegation result, may be null
    /// @param fallback default success message, not null
    /// @return textual result, never null
    public static String firstText(Object result, String fallback) {
        if (result instanceof String text) {
            return text;
        }
        if (result instanceof List<?> list && !list.isEmpty()) {
            if (list.get(0) instanceof Map<?, ?> first && first.get("text") != null) {
                return first.get("text").toString();
            }
            return fallback;
        }
        if (result instanceof Map<?, ?> map) {
            Object message = map.get("message") != null ? map.get("message") : map.get("text");
            if (message != null) {
                return message.toString();
            }
        }
        return fallback;
    }

    /// Describes a failure for an error-prefixed message.
    ///
    /// Unwraps `CompletionException`/`ExecutionException` wrappers so callers see the
    /// message of the delegation failure itself.
    ///
    /// @param failure the failure, may be null
    /// @return description, never null
    public static String describe(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause == null) {
            return "unknown failure";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    /// Returns whether a result is a failure-path result.
    ///
    /// @param result tool result, may be null
    /// @return true if the result starts with {@link #ERROR_PREFIX}
    public static boolean isError(String result) {
        return result != null && result.startsWith(ERROR_PREFIX);
    }
}
