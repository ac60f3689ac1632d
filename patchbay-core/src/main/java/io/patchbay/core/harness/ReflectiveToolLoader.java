package io.patchbay.core.harness;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.runtime.McpTool;
import io.patchbay.core.runtime.ToolFunction;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.logging.Logger;

/// Turns the `@McpTool` methods of an object into {@link ToolFunction}s.
///
/// Only the public methods carrying the marker are loaded. A method may return a
/// completion stage or a plain value; plain values are wrapped in a completed future.
///
/// ### Usage
/// {@snippet :
/// Map<String, ToolFunction> tools = ReflectiveToolLoader.load(new TransportTools());
/// tools.get("set_tempo").invoke(registry, Map.of("bpm", 132.0));
/// }
public final class ReflectiveToolLoader {

    private static final Logger logger = Logger.getLogger(ReflectiveToolLoader.class.getName());

    private ReflectiveToolLoader() {}

    /// Loads every marked method of an instance.
    ///
    /// @param instance object declaring the tools, not null
    /// @return functions keyed by tool name, sorted by method name
    /// @throws IllegalStateException if two methods share a tool name or parameter names are
    ///     missing from the class file
    public static Map<String, ToolFunction> load(Object instance) {
        Objects.requireNonNull(instance, "instance must not be null");
        Map<String, ToolFunction> tools = new LinkedHashMap<>();
        Method[] methods = instance.getClass().getMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));
        for (Method method : methods) {
            McpTool marker = method.getAnnotation(McpTool.class);
            if (marker == null || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            String name =
                    marker.name().isBlank()
                            ? ToolConventions.toSnakeCase(method.getName())
                            : marker.name();
            if (tools.containsKey(name)) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
            tools.put(name, function(instance, method));
            logger.fine("Loaded tool " + name + " from " + instance.getClass().getSimpleName());
        }
        return tools;
    }

    private static ToolFunction function(Object instance, Method method) {
        ArgumentBinder binder = new ArgumentBinder(method);
        // Public methods of non-public classes still fail the access check
        method.setAccessible(true);
        return (context, arguments) -> {
            Object[] values = binder.bind(context, arguments);
            Object result;
            try {
                result = method.invoke(instance, values);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot access tool method " + method.getName(), e);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new CompletionException(cause);
            }
            if (result instanceof CompletionStage<?> stage) {
                return stage.toCompletableFuture().thenApply(value -> Objects.toString(value, null));
            }
            return CompletableFuture.completedFuture(Objects.toString(result, null));
        };
    }
}
