package io.patchbay.core.runtime;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Declares a default for an optional tool parameter.
///
/// Parameters without this annotation are required. The default is written as a Java
/// literal (`4`, `"audio"`, `null`) and converted to the parameter type on invocation.
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {

    /// Sentinel marking a required parameter.
    String REQUIRED = "\0__REQUIRED__";

    /// Default value as a Java literal, or {@link #REQUIRED}.
    String defaultValue() default REQUIRED;
}
