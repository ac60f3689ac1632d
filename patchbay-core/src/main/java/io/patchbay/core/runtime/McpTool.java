package io.patchbay.core.runtime;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a method as an externally exposed tool.
///
/// The canonical forms are `@McpTool`, `@McpTool()` and `@McpTool(name = "snake_case")`.
/// When `name` is empty the tool name is derived from the method name.
///
/// @see io.patchbay.core.rule.RegistrationMarkerRule for the form check
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface McpTool {

    /// Overrides the tool name. Empty means "derive from the method name".
    String name() default "";
}
