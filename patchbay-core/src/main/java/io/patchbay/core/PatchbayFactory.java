package io.patchbay.core;

import io.patchbay.core.catalog.CatalogValidator;
import io.patchbay.core.extract.ToolModelExtractor;
import io.patchbay.core.harness.MockExecutionHarness;
import io.patchbay.core.harness.StandardBattery;
import io.patchbay.core.rule.RuleEngine;
import io.patchbay.core.template.TemplateGenerator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating {@link Toolchain} instances.
///
/// Wires extractor, rule engine, generator, harness and catalog validator around one
/// fixed-size worker pool owned by the toolchain.
///
/// ### Usage
/// {@snippet :
/// try (Toolchain toolchain = PatchbayFactory.createToolchain()) {
///     ValidationReport report = toolchain.validate(definition);
/// }
/// }
///
/// @see PatchbayConfig for options
public final class PatchbayFactory {

    private static final Logger logger = Logger.getLogger(PatchbayFactory.class.getName());

    private PatchbayFactory() {}

    /// Creates a toolchain with default configuration and the canonical rules.
    public static Toolchain createToolchain() {
        return createToolchain(new PatchbayConfig());
    }

    /// Creates a toolchain with the canonical rules.
    ///
    /// @param config options, not null
    /// @return toolchain owning a new worker pool, never null
    public static Toolchain createToolchain(PatchbayConfig config) {
        return createToolchain(config, RuleEngine.withDefaults());
    }

    /// Creates a toolchain with a custom rule engine.
    ///
    /// @param config options, not null
    /// @param engine rules to apply, not null
    /// @return toolchain owning a new worker pool, never null
    /// @throws IllegalArgumentException if the pool size is not positive
    public static Toolchain createToolchain(PatchbayConfig config, RuleEngine engine) {
        if (config.getThreadPoolSize() <= 0) {
            throw new IllegalArgumentException("threadPoolSize must be positive");
        }
        ExecutorService executor = Executors.newFixedThreadPool(config.getThreadPoolSize());
        ToolModelExtractor extractor = new ToolModelExtractor();
        MockExecutionHarness harness =
                new MockExecutionHarness(
                        executor,
                        config.getCaseTimeout(),
                        new StandardBattery(config.getHandlerNames()));
        logger.info(
                "Creating toolchain: threads=" + config.getThreadPoolSize() + ", caseTimeout="
                        + config.getCaseTimeout().toMillis() + "ms, rules=" + engine.rules().size());
        return new Toolchain(
                extractor,
                engine,
                new TemplateGenerator(),
                harness,
                new CatalogValidator(executor, extractor, engine),
                executor);
    }
}
