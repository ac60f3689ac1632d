package io.patchbay.core;

import io.patchbay.core.catalog.CatalogEntry;
import io.patchbay.core.catalog.CatalogReport;
import io.patchbay.core.catalog.CatalogValidator;
import io.patchbay.core.catalog.SourceUnit;
import io.patchbay.core.extract.ExtractionResult;
import io.patchbay.core.extract.ToolExtractionException;
import io.patchbay.core.extract.ToolModelExtractor;
import io.patchbay.core.harness.LiveTool;
import io.patchbay.core.harness.MockExecutionHarness;
import io.patchbay.core.harness.ReflectiveToolLoader;
import io.patchbay.core.harness.TestCase;
import io.patchbay.core.harness.TestReport;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.RuleEngine;
import io.patchbay.core.rule.ValidationReport;
import io.patchbay.core.rule.Verdict;
import io.patchbay.core.runtime.ToolFunction;
import io.patchbay.core.template.GeneratedTool;
import io.patchbay.core.template.TemplateGenerator;
import io.patchbay.core.template.ToolSpec;
import io.patchbay.core.template.ToolSpecException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point bundling extraction, validation, generation and mock execution.
///
/// Validation and harness runs never throw across this boundary: problems come back as
/// failed verdicts, unextractable catalog entries or failed cases. Generation throws
/// {@link ToolSpecException} for invalid specs, as the request cannot proceed.
///
/// ### Contracts
/// - **Precondition**: not used after {@link #close()}
/// - **Invariant**: component references are fixed at construction
///
/// @implNote Safe for concurrent use; all components are stateless apart from the pool.
/// @apiNote Create instances via {@link PatchbayFactory}.
public final class Toolchain implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(Toolchain.class.getName());

    /// Rule id of the verdict reported when generated source cannot be read back.
    public static final String EXTRACTION_RULE_ID = "extraction";

    private final ToolModelExtractor extractor;
    private final RuleEngine ruleEngine;
    private final TemplateGenerator generator;
    private final MockExecutionHarness harness;
    private final CatalogValidator catalogValidator;
    private final ExecutorService executorService;

    public Toolchain(
            ToolModelExtractor extractor,
            RuleEngine ruleEngine,
            TemplateGenerator generator,
            MockExecutionHarness harness,
            CatalogValidator catalogValidator,
            ExecutorService executorService) {
        this.extractor = extractor;
        this.ruleEngine = ruleEngine;
        this.generator = generator;
        this.harness = harness;
        this.catalogValidator = catalogValidator;
        this.executorService = executorService;
    }

    public ToolModelExtractor getExtractor() {
        return extractor;
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public TemplateGenerator getGenerator() {
        return generator;
    }

    public MockExecutionHarness getHarness() {
        return harness;
    }

    /// Validates one definition against every rule.
    public ValidationReport validate(ToolDefinition definition) {
        return ruleEngine.validate(definition);
    }

    /// Validates every tool of the given units on the worker pool.
    public CatalogReport validateSources(List<SourceUnit> units) {
        return catalogValidator.validate(units);
    }

    /// Validates every tool of the given files. Unreadable files are reported as
    /// unextractable entries.
    ///
    /// @param files source files in catalog order, not null
    /// @return aggregated report, never null
    public CatalogReport validateFiles(List<Path> files) {
        List<SourceUnit> units = new ArrayList<>();
        List<CatalogEntry> unreadable = new ArrayList<>();
        for (Path file : files) {
            try {
                units.add(SourceUnit.read(file));
            } catch (IOException e) {
                logger.warning("Cannot read " + file + ": " + e.getMessage());
                unreadable.add(
                        new CatalogEntry.Unextractable(
                                file.getFileName().toString(), "cannot read source: " + e.getMessage()));
            }
        }
        CatalogReport report = catalogValidator.validate(units);
        if (unreadable.isEmpty()) {
            return report;
        }
        List<CatalogEntry> entries = new ArrayList<>(report.entries());
        entries.addAll(unreadable);
        return new CatalogReport(entries, report.duplicateNames());
    }

    /// Generates a tool from a spec.
    ///
    /// @throws ToolSpecException if the spec is invalid
    public GeneratedTool generate(ToolSpec spec) throws ToolSpecException {
        return generator.generate(spec);
    }

    /// Reads generated source back and validates it.
    ///
    /// @param tool a generated tool, not null
    /// @return the report; an unreadable source yields a single failed `extraction` verdict
    public ValidationReport selfValidate(GeneratedTool tool) {
        try {
            return validate(extractor.extract(tool.name(), tool.source()));
        } catch (ToolExtractionException e) {
            logger.warning("Generated source of " + tool.name() + " is unreadable: " + e.getMessage());
            return ValidationReport.of(
                    tool.name(),
                    List.of(
                            Verdict.fail(
                                    EXTRACTION_RULE_ID,
                                    e.getMessage(),
                                    "Report the spec that produced this source")));
        }
    }

    /// Pairs a generated tool's executable form with the definition of its source.
    ///
    /// @throws ToolExtractionException if the generated source cannot be read back
    public LiveTool liveTool(GeneratedTool tool) throws ToolExtractionException {
        return new LiveTool(extractor.extract(tool.name(), tool.source()), tool.function());
    }

    /// Pairs the `@McpTool` methods of an instance with the definitions extracted from
    /// their source.
    ///
    /// @param instance object declaring the tools, not null
    /// @param unit source of the instance's class, not null
    /// @return live tools in declaration order
    /// @throws ToolExtractionException if a tool of the source is unreadable or has no
    ///     loaded method
    public List<LiveTool> liveTools(Object instance, SourceUnit unit) throws ToolExtractionException {
        Map<String, ToolFunction> functions = ReflectiveToolLoader.load(instance);
        List<LiveTool> tools = new ArrayList<>();
        for (ExtractionResult result : extractor.extractAll(unit.unitId(), unit.source())) {
            if (result instanceof ExtractionResult.Failed failed) {
                throw failed.error();
            }
            ToolDefinition definition =
                    ((ExtractionResult.Extracted) result).definition();
            ToolFunction function = functions.get(definition.name());
            if (function == null) {
                throw new ToolExtractionException(
                        unit.unitId(), "no @McpTool method loaded for tool " + definition.name());
            }
            tools.add(new LiveTool(definition, function));
        }
        return tools;
    }

    /// Runs the standard battery.
    public TestReport test(LiveTool tool) {
        return harness.run(tool);
    }

    /// Runs custom cases instead of the standard battery.
    public TestReport test(LiveTool tool, List<TestCase> cases) {
        return harness.run(tool, cases);
    }

    /// Shuts down the worker pool. Running tasks finish; no new work is accepted.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
