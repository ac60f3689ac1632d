package io.patchbay.core.rule;

import io.patchbay.core.model.Docstring;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import java.util.List;

/// The doc comment has a summary and documents every declared parameter.
public final class DocstringRule implements ToolRule {

    public static final String ID = "docstring";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Doc comment has a summary and an @param entry for every parameter";
    }

    @Override
    public Verdict evaluate(ToolDefinition definition) {
        Docstring docs = definition.docstring();
        List<String> undocumented =
                definition.parameters().stream()
                        .map(ToolParameter::name)
                        .filter(name -> docs.describe(name) == null)
                        .toList();

        if (docs.hasSummary() && undocumented.isEmpty()) {
            return Verdict.pass(ID, "Documentation complete");
        }
        if (!docs.hasSummary()) {
            return Verdict.fail(
                    ID,
                    "Tool " + definition.name() + " has no doc summary",
                    "Add a doc comment starting with a one-line summary"
                            + (undocumented.isEmpty()
                                    ? ""
                                    : " and @param entries for " + String.join(", ", undocumented)));
        }
        return Verdict.fail(
                ID,
                "Undocumented parameters: " + String.join(", ", undocumented),
                "Add @param entries for " + String.join(", ", undocumented));
    }
}
