package io.patchbay.core.harness;

import java.util.Objects;

/// What a simulated delegation operation does when called.
public sealed interface MockBehavior
        permits MockBehavior.Returns, MockBehavior.FailsAsync, MockBehavior.Throws, MockBehavior.Hangs {

    static MockBehavior returns(Object payload) {
        return new Returns(payload);
    }

    static MockBehavior failsAsync(String message) {
        return new FailsAsync(message);
    }

    static MockBehavior throwsSync(String message) {
        return new Throws(message);
    }

    static MockBehavior hangs() {
        return Hangs.INSTANCE;
    }

    /// Completes with a fixed result.
    ///
    /// @param payload result, may be null
    record Returns(Object payload) implements MockBehavior {}

    /// Returns a future that fails with {@link MockDelegationException}.
    ///
    /// @param message failure message, not null
    record FailsAsync(String message) implements MockBehavior {
        public FailsAsync {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /// Throws {@link MockDelegationException} from the call itself.
    ///
    /// @param message failure message, not null
    record Throws(String message) implements MockBehavior {
        public Throws {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /// Returns a future that never completes.
    final class Hangs implements MockBehavior {
        static final Hangs INSTANCE = new Hangs();

        private Hangs() {}

        @Override
        public String toString() {
            return "Hangs";
        }
    }
}
