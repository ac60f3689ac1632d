package io.patchbay.core.model;

import io.patchbay.core.runtime.ToolContext;
import java.util.Objects;

/// How a tool reaches the delegation layer.
///
/// Generator and validator consume this same tagged variant:
/// - {@link Delegated}: through a named handler, `context.handler(target)`
/// - {@link Direct}: through the single backend, `context.direct()`
/// - {@link None}: pure computation, no delegation
public sealed interface DelegationMode
        permits DelegationMode.Delegated, DelegationMode.Direct, DelegationMode.None {

    /// Returns the registry target name, or null for {@link None}.
    String target();

    /// Returns the invoked operation, or null for {@link None}.
    String method();

    default boolean delegates() {
        return !(this instanceof None);
    }

    static DelegationMode delegated(String target, String method) {
        return new Delegated(target, method);
    }

    static DelegationMode direct(String method) {
        return new Direct(method);
    }

    static DelegationMode none() {
        return None.INSTANCE;
    }

    /// Named-handler delegation.
    ///
    /// @param target handler name, not null
    /// @param method operation name, not null
    record Delegated(String target, String method) implements DelegationMode {
        public Delegated {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(method, "method must not be null");
        }
    }

    /// Direct backend delegation.
    ///
    /// @param method operation name, not null
    record Direct(String method) implements DelegationMode {
        public Direct {
            Objects.requireNonNull(method, "method must not be null");
        }

        @Override
        public String target() {
            return ToolContext.DIRECT_TARGET;
        }
    }

    /// No delegation.
    final class None implements DelegationMode {
        static final None INSTANCE = new None();

        private None() {}

        @Override
        public String target() {
            return null;
        }

        @Override
        public String method() {
            return null;
        }

        @Override
        public String toString() {
            return "None";
        }
    }
}
