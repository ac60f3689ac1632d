package io.patchbay.core.harness;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable recipe for a {@link MockRegistry}.
///
/// A config is shared freely; the registry built from it is not. Stubs are keyed by
/// target and method, either of which may be the wildcard `*`.
///
/// ### Usage
/// {@snippet :
/// MockRegistryConfig config = MockRegistryConfig.available()
///         .stub("transport", "set_tempo", MockBehavior.returns("Tempo set"))
///         .build();
/// }
///
/// @param online whether handles resolve at all
/// @param knownTargets targets that resolve, empty for any target
/// @param stubs behavior per `target#method` key
/// @param fallback behavior of unstubbed operations
public record MockRegistryConfig(
        boolean online,
        Set<String> knownTargets,
        Map<String, MockBehavior> stubs,
        MockBehavior fallback) {

    public static final String WILDCARD = "*";

    public MockRegistryConfig {
        knownTargets =
                knownTargets != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(knownTargets))
                        : Set.of();
        stubs =
                stubs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(stubs))
                        : Map.of();
        fallback = fallback != null ? fallback : MockBehavior.returns(null);
    }

    /// A registry whose handles are all unavailable (the backend is not initialized).
    public static MockRegistryConfig unavailable() {
        return new MockRegistryConfig(false, Set.of(), Map.of(), null);
    }

    /// Starts an available registry.
    public static Builder available() {
        return new Builder();
    }

    /// Returns whether a target resolves to a handle.
    public boolean resolves(String target) {
        return online && (knownTargets.isEmpty() || knownTargets.contains(target));
    }

    /// Returns the behavior of one operation, most specific stub first.
    public MockBehavior behaviorOf(String target, String method) {
        for (String key :
                new String[] {
                    key(target, method), key(target, WILDCARD), key(WILDCARD, method),
                    key(WILDCARD, WILDCARD)
                }) {
            MockBehavior behavior = stubs.get(key);
            if (behavior != null) {
                return behavior;
            }
        }
        return fallback;
    }

    static String key(String target, String method) {
        return target + "#" + method;
    }

    public static final class Builder {
        private final Set<String> knownTargets = new LinkedHashSet<>();
        private final Map<String, MockBehavior> stubs = new LinkedHashMap<>();
        private MockBehavior fallback;

        private Builder() {}

        /// Restricts resolution to the given targets. The direct backend is a target too.
        public Builder knownTargets(Set<String> targets) {
            this.knownTargets.addAll(targets);
            return this;
        }

        public Builder stub(String target, String method, MockBehavior behavior) {
            Objects.requireNonNull(behavior, "behavior must not be null");
            stubs.put(key(target, method), behavior);
            return this;
        }

        /// Behavior of every operation not stubbed explicitly.
        public Builder fallback(MockBehavior behavior) {
            this.fallback = behavior;
            return this;
        }

        public MockRegistryConfig build() {
            return new MockRegistryConfig(true, knownTargets, stubs, fallback);
        }
    }
}
