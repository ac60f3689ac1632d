package io.patchbay.core.harness;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.runtime.Param;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.template.TypeMapping;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Map;

/// Binds named arguments to the parameters of a reflected tool method.
///
/// Parameter names come from the class file, so tool classes must be compiled with
/// `-parameters`. Missing arguments take their `@Param` default; a missing required
/// argument is an {@link IllegalArgumentException}, as a direct call could not be made.
final class ArgumentBinder {

    private final Method method;
    private final Parameter[] parameters;
    private final boolean takesContext;

    ArgumentBinder(Method method) {
        this.method = method;
        this.parameters = method.getParameters();
        this.takesContext =
                parameters.length > 0 && ToolContext.class.isAssignableFrom(parameters[0].getType());
        for (Parameter parameter : parameters) {
            if (!parameter.isNamePresent()) {
                throw new IllegalStateException(
                        "Parameter names of " + method.getDeclaringClass().getName() + "."
                                + method.getName() + " are not available; compile with -parameters");
            }
        }
    }

    /// Returns the argument array for one invocation.
    Object[] bind(ToolContext context, Map<String, Object> arguments) {
        Object[] values = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (i == 0 && takesContext) {
                values[i] = context;
                continue;
            }
            String type = typeName(parameter.getType());
            if (arguments.containsKey(parameter.getName())) {
                values[i] = TypeMapping.coerce(arguments.get(parameter.getName()), type);
                continue;
            }
            Param param = parameter.getAnnotation(Param.class);
            if (param == null || Param.REQUIRED.equals(param.defaultValue())) {
                throw new IllegalArgumentException(
                        "Missing required argument '" + parameter.getName() + "' for "
                                + ToolConventions.toSnakeCase(method.getName()));
            }
            values[i] = TypeMapping.parseLiteral(param.defaultValue(), type);
        }
        return values;
    }

    private static String typeName(Class<?> type) {
        return type.isPrimitive() ? type.getName() : type.getSimpleName();
    }
}
