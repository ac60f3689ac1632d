package io.patchbay.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.patchbay.core.catalog.CatalogEntry;
import io.patchbay.core.catalog.CatalogReport;
import io.patchbay.core.harness.Invocation;
import io.patchbay.core.harness.TestReport;
import io.patchbay.core.harness.TestResult;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.rule.ValidationReport;
import io.patchbay.core.rule.Verdict;
import java.util.Collection;

/// Writes validation, catalog and harness reports as pretty-printed JSON.
///
/// Documents are built as trees so field names stay stable when the report records change.
/// Catalog entries carry a `"type"` discriminator (`validated` or `unextractable`). Elapsed
/// times are ISO-8601 durations.
///
/// ### Usage
/// {@snippet :
/// ValidationReport report = toolchain.validate(definition);
/// Files.writeString(out, ReportJsonWriter.toJson(report));
/// }
///
/// @implNote Thread-safe. Stateless.
/// @see io.patchbay.core.report.ReportRenderer for the text rendering
public final class ReportJsonWriter {

    private ReportJsonWriter() {}

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ValidationReport report) {
        ObjectMapper mapper = ToolSpecReader.createMapper();
        return write(mapper, validationNode(mapper, report));
    }

    /// Writes several validation reports as one JSON array.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Collection<ValidationReport> reports) {
        ObjectMapper mapper = ToolSpecReader.createMapper();
        ArrayNode array = mapper.createArrayNode();
        reports.forEach(report -> array.add(validationNode(mapper, report)));
        return write(mapper, array);
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(CatalogReport report) {
        ObjectMapper mapper = ToolSpecReader.createMapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("total", report.total());
        root.put("valid", report.validCount());
        root.put("invalid", report.invalidCount());
        root.put("allPassed", report.allPassed());
        ArrayNode duplicates = root.putArray("duplicateNames");
        report.duplicateNames().forEach(duplicates::add);

        ArrayNode entries = root.putArray("entries");
        for (CatalogEntry entry : report.entries()) {
            ObjectNode node = entries.addObject();
            if (entry instanceof CatalogEntry.Validated validated) {
                ToolDefinition definition = validated.definition();
                node.put("type", "validated");
                node.put("name", definition.name());
                node.put("methodName", definition.methodName());
                node.put("location", definition.location());
                node.set("delegation", mapper.valueToTree(definition.delegation()));
                node.set("report", validationNode(mapper, validated.report()));
            } else if (entry instanceof CatalogEntry.Unextractable unextractable) {
                node.put("type", "unextractable");
                node.put("unitId", unextractable.unitId());
                node.put("message", unextractable.message());
            }
            node.put("valid", entry.valid());
        }
        return write(mapper, root);
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(TestReport report) {
        ObjectMapper mapper = ToolSpecReader.createMapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("toolName", report.toolName());
        root.put("passed", report.passedCount());
        root.put("failed", report.failedCount());
        root.put("skipped", report.skippedCount());
        root.put("successRate", report.successRate());
        root.put("allPassed", report.allPassed());

        ArrayNode cases = root.putArray("cases");
        for (TestResult result : report.results()) {
            ObjectNode node = cases.addObject();
            node.put("description", result.testCase().description());
            node.put("kind", result.testCase().kind().name());
            node.put("expected", result.testCase().expectedOutcomeKind().name());
            node.put("actual", result.actualOutcomeKind().name());
            node.put("result", result.actualResult());
            node.put("status", result.skipped() ? "SKIPPED" : result.passed() ? "PASSED" : "FAILED");
            if (result.mismatch() != null) {
                node.put("mismatch", result.mismatch());
            }
            node.set("elapsed", mapper.valueToTree(result.elapsed()));
            ArrayNode invocations = node.putArray("invocations");
            for (Invocation invocation : result.invocations()) {
                ObjectNode call = invocations.addObject();
                call.put("target", invocation.target());
                call.put("method", invocation.method());
                call.set("arguments", mapper.valueToTree(invocation.arguments()));
            }
        }
        return write(mapper, root);
    }

    private static ObjectNode validationNode(ObjectMapper mapper, ValidationReport report) {
        ObjectNode node = mapper.createObjectNode();
        node.put("toolName", report.toolName());
        node.put("overallPassed", report.overallPassed());
        ArrayNode verdicts = node.putArray("verdicts");
        for (Verdict verdict : report.verdicts()) {
            ObjectNode v = verdicts.addObject();
            v.put("ruleId", verdict.ruleId());
            v.put("passed", verdict.passed());
            v.put("message", verdict.message());
            if (!verdict.suggestion().isEmpty()) {
                v.put("suggestion", verdict.suggestion());
            }
        }
        return node;
    }

    private static String write(ObjectMapper mapper, Object tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
