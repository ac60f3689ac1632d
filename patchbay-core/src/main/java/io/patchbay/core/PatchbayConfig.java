package io.patchbay.core;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/// Configuration options for the toolchain.
///
/// Controls the worker pool, the per-case harness timeout and the handler names the
/// simulated delegation layer recognizes.
///
/// ### Default Values
/// - `threadPoolSize`: `4`
/// - `caseTimeout`: 5 seconds
/// - `handlerNames`: empty (every handler name resolves)
///
/// ### Property Keys
/// - `patchbay.threads`
/// - `patchbay.harness.timeout-ms`
/// - `patchbay.handlers` (comma separated)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link PatchbayFactory};
/// do not modify afterwards.
///
/// @see PatchbayFactory#createToolchain(PatchbayConfig)
public class PatchbayConfig {

    public static final String THREADS_PROPERTY = "patchbay.threads";
    public static final String TIMEOUT_PROPERTY = "patchbay.harness.timeout-ms";
    public static final String HANDLERS_PROPERTY = "patchbay.handlers";

    private int threadPoolSize = 4;
    private Duration caseTimeout = Duration.ofSeconds(5);
    private Set<String> handlerNames = new LinkedHashSet<>();

    /// Creates a configuration with default values.
    public PatchbayConfig() {}

    /// Reads a configuration from properties; absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a present value is not a positive number
    public static PatchbayConfig fromProperties(Properties properties) {
        PatchbayConfig config = new PatchbayConfig();
        String threads = properties.getProperty(THREADS_PROPERTY);
        if (threads != null) {
            config.setThreadPoolSize(positive(THREADS_PROPERTY, threads));
        }
        String timeout = properties.getProperty(TIMEOUT_PROPERTY);
        if (timeout != null) {
            config.setCaseTimeout(Duration.ofMillis(positive(TIMEOUT_PROPERTY, timeout)));
        }
        String handlers = properties.getProperty(HANDLERS_PROPERTY);
        if (handlers != null) {
            Set<String> names = new LinkedHashSet<>();
            Arrays.stream(handlers.split(","))
                    .map(String::strip)
                    .filter(name -> !name.isEmpty())
                    .forEach(names::add);
            config.setHandlerNames(names);
        }
        return config;
    }

    private static int positive(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.strip());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a positive integer: " + value, e);
        }
        throw new IllegalArgumentException(key + " must be a positive integer: " + value);
    }

    /// Returns the size of the worker pool used for catalog validation and tool invocation.
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns the time the harness waits for one case.
    public Duration getCaseTimeout() {
        return caseTimeout;
    }

    public void setCaseTimeout(Duration caseTimeout) {
        this.caseTimeout = caseTimeout;
    }

    /// Returns the handler names the simulated delegation layer resolves, empty for any.
    public Set<String> getHandlerNames() {
        return handlerNames;
    }

    public void setHandlerNames(Set<String> handlerNames) {
        this.handlerNames = new LinkedHashSet<>(handlerNames);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PatchbayConfig}.
    public static class Builder {
        private final PatchbayConfig config = new PatchbayConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder caseTimeout(Duration caseTimeout) {
            config.caseTimeout = caseTimeout;
            return this;
        }

        public Builder handlerNames(Set<String> handlerNames) {
            config.setHandlerNames(handlerNames);
            return this;
        }

        public PatchbayConfig build() {
            return config;
        }
    }
}
