package io.patchbay.core.template;

import java.io.Serial;
import java.util.List;

/// Thrown when a {@link ToolSpec} cannot be generated.
///
/// Lists every problem found, not just the first. Fatal to the generation request only.
public class ToolSpecException extends Exception {

    @Serial private static final long serialVersionUID = -2290417446861405512L;

    private final List<String> problems;

    /// Creates exception listing all problems.
    ///
    /// @param problems one entry per problem, not empty
    public ToolSpecException(List<String> problems) {
        super("Invalid tool spec: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /// Creates exception for a single problem with a cause.
    ///
    /// @param problem description of the problem
    /// @param cause the underlying exception
    public ToolSpecException(String problem, Throwable cause) {
        super("Invalid tool spec: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
