package io.patchbay.core.catalog;

import io.patchbay.core.extract.ExtractionResult;
import io.patchbay.core.extract.ToolModelExtractor;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.RuleEngine;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Validates every tool of a set of source units.
///
/// Units are extracted and validated in parallel on the supplied pool; results are
/// collected in submission order, so the report follows declaration order regardless of
/// scheduling. A unit that crashes is reported, never propagated.
///
/// ### Contracts
/// - **Precondition**: the executor is not shut down
/// - **Postcondition**: entries follow unit order, then declaration order
///
/// @implNote Thread-safe; extractor and engine are stateless.
public class CatalogValidator {

    private static final Logger logger = Logger.getLogger(CatalogValidator.class.getName());

    private final ExecutorService executor;
    private final ToolModelExtractor extractor;
    private final RuleEngine engine;

    /// @param executor pool running one task per unit, not null
    /// @param extractor source reader, not null
    /// @param engine rules to apply, not null
    public CatalogValidator(ExecutorService executor, ToolModelExtractor extractor, RuleEngine engine) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /// Validates all units.
    ///
    /// @param units units in catalog order, not null
    /// @return aggregated report, never null
    public CatalogReport validate(List<SourceUnit> units) {
        logger.info("Validating catalog of " + units.size() + " units");

        List<Future<List<CatalogEntry>>> futures =
                units.stream().map(unit -> executor.submit(() -> validateUnit(unit))).toList();

        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String unitId = units.get(i).unitId();
            try {
                entries.addAll(futures.get(i).get());
            } catch (ExecutionException e) {
                logger.warning("Validation crashed for unit " + unitId + ": " + e.getCause());
                entries.add(
                        new CatalogEntry.Unextractable(
                                unitId, "validation crashed: " + e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                for (int j = i; j < units.size(); j++) {
                    entries.add(new CatalogEntry.Unextractable(units.get(j).unitId(), "interrupted"));
                }
                break;
            }
        }

        CatalogReport report = new CatalogReport(entries, duplicates(entries));
        logger.info(
                "Catalog validated: " + report.total() + " tools, " + report.validCount()
                        + " valid, " + report.invalidCount() + " invalid");
        if (!report.duplicateNames().isEmpty()) {
            logger.warning("Duplicate tool names: " + report.duplicateNames());
        }
        return report;
    }

    private List<CatalogEntry> validateUnit(SourceUnit unit) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (ExtractionResult result : extractor.extractAll(unit.unitId(), unit.source())) {
            if (result instanceof ExtractionResult.Extracted extracted) {
                ToolDefinition definition = extracted.definition();
                entries.add(new CatalogEntry.Validated(definition, engine.validate(definition)));
            } else {
                ExtractionResult.Failed failed = (ExtractionResult.Failed) result;
                entries.add(
                        new CatalogEntry.Unextractable(
                                failed.error().getUnitId(), failed.error().getMessage()));
            }
        }
        return entries;
    }

    private static Set<String> duplicates(List<CatalogEntry> entries) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (CatalogEntry entry : entries) {
            if (entry instanceof CatalogEntry.Validated validated
                    && !seen.add(validated.definition().name())) {
                duplicates.add(validated.definition().name());
            }
        }
        return duplicates;
    }
}
