package io.patchbay.core.harness;

import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.ToolContext;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Simulated delegation layer handed to a tool as its {@link ToolContext}.
///
/// Every call is recorded before its behavior runs, so a failing or hanging operation
/// still shows up in {@link #invocations()}.
///
/// ### Contracts
/// - **Precondition**: built fresh for every test case, never shared
/// - **Postcondition**: {@link #invocations()} lists calls in arrival order
///
/// @implNote Thread-safe: the invocation record is a {@link CopyOnWriteArrayList}.
/// @see MockRegistryConfig for the recipe
public final class MockRegistry implements ToolContext {

    private static final Logger logger = Logger.getLogger(MockRegistry.class.getName());

    private final MockRegistryConfig config;
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<Object>> pending = new CopyOnWriteArrayList<>();

    private MockRegistry(MockRegistryConfig config) {
        this.config = config;
    }

    /// Builds a fresh registry.
    ///
    /// @param config the recipe, not null
    /// @return registry with an empty invocation record
    public static MockRegistry from(MockRegistryConfig config) {
        return new MockRegistry(Objects.requireNonNull(config, "config must not be null"));
    }

    @Override
    public DelegationHandle handler(String name) {
        return config.resolves(name) ? new MockHandle(name) : null;
    }

    @Override
    public DelegationHandle direct() {
        return config.resolves(DIRECT_TARGET) ? new MockHandle(DIRECT_TARGET) : null;
    }

    /// Returns the calls made so far, in arrival order.
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public boolean untouched() {
        return invocations.isEmpty();
    }

    /// Cancels the futures of operations configured to hang.
    public void cancelPending() {
        pending.forEach(future -> future.cancel(true));
        pending.clear();
    }

    private final class MockHandle implements DelegationHandle {
        private final String target;

        private MockHandle(String target) {
            this.target = target;
        }

        @Override
        public CompletableFuture<Object> call(String method, Map<String, Object> arguments) {
            invocations.add(new Invocation(target, method, arguments));
            MockBehavior behavior = config.behaviorOf(target, method);
            logger.fine("Mock call " + target + "." + method + " -> " + behavior);

            if (behavior instanceof MockBehavior.Returns returns) {
                return CompletableFuture.completedFuture(returns.payload());
            }
            if (behavior instanceof MockBehavior.FailsAsync fails) {
                return CompletableFuture.failedFuture(new MockDelegationException(fails.message()));
            }
            if (behavior instanceof MockBehavior.Throws throwing) {
                throw new MockDelegationException(throwing.message());
            }
            CompletableFuture<Object> never = new CompletableFuture<>();
            pending.add(never);
            return never;
        }
    }
}
