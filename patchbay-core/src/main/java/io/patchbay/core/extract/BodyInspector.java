package io.patchbay.core.extract;

import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.model.BodyShape;
import io.patchbay.core.model.DelegationMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Inspects the surface structure of one method body.
///
/// Works on the masked view of the source, so braces and keywords inside comments or
/// string literals never count. Nothing is evaluated: the facts are positional
/// (a null check occurs between acquiring the handle and calling it, a `try` range
/// contains the call, and so on).
final class BodyInspector {

    private static final Pattern IF = Pattern.compile("\\bif\\s*\\(");
    private static final Pattern NULL_CHECK = Pattern.compile("==\\s*null\\b|\\bnull\\s*==");
    private static final Pattern RETURN = Pattern.compile("\\breturn\\b");
    private static final Pattern TRY = Pattern.compile("\\btry\\s*([({])");
    private static final Pattern RECOVERY =
            Pattern.compile("\\.\\s*(?:exceptionally|exceptionallyCompose|handle)\\s*\\(");
    private static final Set<String> BOUNDARY_TYPES =
            Set.of("Exception", "Throwable", "RuntimeException");

    private final SourceText source;
    private final String masked;
    private final int bodyStart;
    private final int bodyEnd;
    private final String contextName;
    private final List<String> parameterNames;
    private final Set<String> restrictedParameters;

    /// @param source the unit, not null
    /// @param bodyStart offset of the opening brace
    /// @param bodyEnd offset of the closing brace
    /// @param contextName name of the injected context parameter, null when absent
    /// @param parameterNames declared parameter names in order, not null
    /// @param restrictedParameters parameters whose documentation names a domain, not null
    BodyInspector(
            SourceText source,
            int bodyStart,
            int bodyEnd,
            String contextName,
            List<String> parameterNames,
            Set<String> restrictedParameters) {
        this.source = source;
        this.masked = source.masked();
        this.bodyStart = bodyStart;
        this.bodyEnd = bodyEnd;
        this.contextName = contextName;
        this.parameterNames = parameterNames;
        this.restrictedParameters = restrictedParameters;
    }

    /// Facts about one body.
    record BodyFacts(BodyShape shape, Set<String> guards, DelegationMode delegation) {}

    BodyFacts inspect() {
        Delegation delegation = findDelegation();
        List<TryBlock> tries = findTryBlocks();
        List<Range> ifs = findIfs();

        boolean guarded = delegation.call >= 0 && hasInitializationGuard(delegation);
        boolean boundary = hasFailureBoundary(delegation, tries);
        boolean consistent = errorPathsConsistent(ifs, tries);
        Set<String> guards = validationGuards(ifs, delegation);

        return new BodyFacts(new BodyShape(guarded, boundary, consistent), guards, delegation.mode);
    }

    // --- delegation ---

    private static final class Delegation {
        DelegationMode mode = DelegationMode.none();
        String handleVariable;
        int acquiredAt = -1;
        int call = -1;
    }

    private Delegation findDelegation() {
        Delegation found = new Delegation();
        if (contextName == null) {
            return found;
        }
        String ctx = Pattern.quote(contextName);

        // A chained `.call(` after the lookup is the inline form, not an acquisition
        Matcher handler =
                Pattern.compile(
                                "\\b(\\w+)\\s*=\\s*" + ctx
                                        + "\\s*\\.\\s*handler\\s*\\(([^()]*)\\)(?!\\s*\\.)")
                        .matcher(masked)
                        .region(bodyStart, bodyEnd);
        Matcher direct =
                Pattern.compile(
                                "\\b(\\w+)\\s*=\\s*" + ctx
                                        + "\\s*\\.\\s*direct\\s*\\(\\s*\\)(?!\\s*\\.)")
                        .matcher(masked)
                        .region(bodyStart, bodyEnd);
        boolean hasHandler = handler.find();
        boolean hasDirect = direct.find();
        String target = null;

        if (hasHandler && (!hasDirect || handler.start() < direct.start())) {
            found.handleVariable = handler.group(1);
            found.acquiredAt = handler.end();
            String literal = source.firstLiteral(handler.start(2), handler.end(2));
            target = literal != null ? literal : "<dynamic>";
        } else if (hasDirect) {
            found.handleVariable = direct.group(1);
            found.acquiredAt = direct.end();
        }

        if (found.handleVariable != null) {
            Matcher call =
                    Pattern.compile("\\b" + Pattern.quote(found.handleVariable) + "\\s*\\.\\s*call\\s*\\(")
                            .matcher(masked)
                            .region(found.acquiredAt, bodyEnd);
            if (call.find()) {
                found.call = call.start();
                String method = methodLiteral(call.end());
                found.mode =
                        target != null
                                ? DelegationMode.delegated(target, method)
                                : DelegationMode.direct(method);
            }
            return found;
        }

        Matcher inline =
                Pattern.compile(
                                "\\b"
                                        + ctx
                                        + "\\s*\\.\\s*(handler|direct)\\s*\\(([^()]*)\\)\\s*\\.\\s*call\\s*\\(")
                        .matcher(masked)
                        .region(bodyStart, bodyEnd);
        if (inline.find()) {
            found.call = inline.start();
            String method = methodLiteral(inline.end());
            if ("handler".equals(inline.group(1))) {
                String inlineTarget = source.firstLiteral(inline.start(2), inline.end(2));
                found.mode =
                        DelegationMode.delegated(
                                inlineTarget != null ? inlineTarget : "<dynamic>", method);
            } else {
                found.mode = DelegationMode.direct(method);
            }
        }
        return found;
    }

    private String methodLiteral(int afterParen) {
        int at = source.skipWhitespace(afterParen);
        String literal = source.literalAt(at);
        return literal != null ? literal : "<dynamic>";
    }

    private boolean hasInitializationGuard(Delegation delegation) {
        if (delegation.handleVariable == null) {
            return false;
        }
        String var = Pattern.quote(delegation.handleVariable);
        Matcher guard =
                Pattern.compile(
                                "\\bif\\s*\\(\\s*(?:"
                                        + var
                                        + "\\s*==\\s*null|null\\s*==\\s*"
                                        + var
                                        + ")\\s*\\)")
                        .matcher(masked)
                        .region(delegation.acquiredAt, delegation.call);
        while (guard.find()) {
            Range branch = branchAfter(guard.end() - 1);
            if (RETURN.matcher(masked).region(branch.start, branch.end).find()) {
                return true;
            }
        }
        return false;
    }

    // --- failure boundary ---

    private record CatchClause(List<String> types, Range body) {}

    private record TryBlock(Range body, List<CatchClause> catches) {
        boolean isBoundary(String masked) {
            for (CatchClause clause : catches) {
                boolean broad = clause.types.stream().anyMatch(BOUNDARY_TYPES::contains);
                if (broad
                        && RETURN.matcher(masked)
                                .region(clause.body.start, clause.body.end)
                                .find()) {
                    return true;
                }
            }
            return false;
        }
    }

    private List<TryBlock> findTryBlocks() {
        List<TryBlock> blocks = new ArrayList<>();
        Matcher matcher = TRY.matcher(masked).region(bodyStart, bodyEnd);
        while (matcher.find()) {
            int brace = matcher.start(1);
            if (masked.charAt(brace) == '(') {
                int close = source.matching(brace, bodyEnd);
                if (close < 0) {
                    continue;
                }
                brace = source.skipWhitespace(close + 1);
                if (brace >= bodyEnd || masked.charAt(brace) != '{') {
                    continue;
                }
            }
            int tryEnd = source.matching(brace, bodyEnd);
            if (tryEnd < 0) {
                continue;
            }
            List<CatchClause> catches = new ArrayList<>();
            int at = source.skipWhitespace(tryEnd + 1);
            while (masked.startsWith("catch", at)) {
                int open = source.skipWhitespace(at + 5);
                if (open >= bodyEnd || masked.charAt(open) != '(') {
                    break;
                }
                int close = source.matching(open, bodyEnd);
                if (close < 0) {
                    break;
                }
                List<String> types = catchTypes(source.original().substring(open + 1, close));
                int blockOpen = source.skipWhitespace(close + 1);
                if (blockOpen >= bodyEnd || masked.charAt(blockOpen) != '{') {
                    break;
                }
                int blockClose = source.matching(blockOpen, bodyEnd);
                if (blockClose < 0) {
                    break;
                }
                catches.add(new CatchClause(types, new Range(blockOpen, blockClose)));
                at = source.skipWhitespace(blockClose + 1);
            }
            blocks.add(new TryBlock(new Range(brace, tryEnd), catches));
        }
        return blocks;
    }

    private static List<String> catchTypes(String declaration) {
        List<String> types = new ArrayList<>();
        for (String alternative : declaration.split("\\|")) {
            String[] tokens = alternative.strip().split("\\s+");
            for (String token : tokens) {
                if (!token.equals("final") && !token.startsWith("@") && !token.isEmpty()) {
                    types.add(token.substring(token.lastIndexOf('.') + 1));
                    break;
                }
            }
        }
        return types;
    }

    private boolean hasFailureBoundary(Delegation delegation, List<TryBlock> tries) {
        if (delegation.call < 0) {
            return tries.stream().anyMatch(t -> t.isBoundary(masked));
        }
        boolean enclosed =
                tries.stream()
                        .filter(t -> t.isBoundary(masked))
                        .anyMatch(t -> t.body.contains(delegation.call));
        if (!enclosed) {
            return false;
        }
        int end = source.statementEnd(delegation.call, bodyEnd);
        return RECOVERY.matcher(masked).region(delegation.call, end).find();
    }

    // --- error paths and guards ---

    private record Range(int start, int end) {
        boolean contains(int offset) {
            return start <= offset && offset <= end;
        }
    }

    /// Condition and branch of one `if` statement.
    private List<Range> findIfs() {
        List<Range> ifs = new ArrayList<>();
        Matcher matcher = IF.matcher(masked).region(bodyStart, bodyEnd);
        while (matcher.find()) {
            int open = matcher.end() - 1;
            int close = source.matching(open, bodyEnd);
            if (close >= 0) {
                ifs.add(new Range(open, close));
            }
        }
        return ifs;
    }

    private Range branchAfter(int conditionClose) {
        int start = source.skipWhitespace(conditionClose + 1);
        if (start < bodyEnd && masked.charAt(start) == '{') {
            int close = source.matching(start, bodyEnd);
            return new Range(start, close < 0 ? bodyEnd : close);
        }
        return new Range(start, source.statementEnd(start, bodyEnd));
    }

    private List<String> returnLiterals(Range range, Set<Integer> seen) {
        List<String> literals = new ArrayList<>();
        Matcher matcher = RETURN.matcher(masked).region(range.start, range.end);
        while (matcher.find()) {
            if (!seen.add(matcher.start())) {
                continue;
            }
            int end = source.statementEnd(matcher.end(), range.end);
            String literal = source.firstLiteral(matcher.end(), end);
            if (literal != null) {
                literals.add(literal);
            }
        }
        return literals;
    }

    /// Error paths are `== null` checks, restricted-parameter guards, catch blocks and
    /// recovery stages. Other early returns are ordinary results.
    private boolean errorPathsConsistent(List<Range> ifs, List<TryBlock> tries) {
        Set<Integer> seen = new HashSet<>();
        List<String> literals = new ArrayList<>();
        for (Range condition : ifs) {
            if (isErrorCondition(condition)) {
                literals.addAll(returnLiterals(branchAfter(condition.end), seen));
            }
        }
        for (TryBlock block : tries) {
            for (CatchClause clause : block.catches) {
                literals.addAll(returnLiterals(clause.body, seen));
            }
        }
        Matcher recovery = RECOVERY.matcher(masked).region(bodyStart, bodyEnd);
        while (recovery.find()) {
            int open = recovery.end() - 1;
            int close = source.matching(open, bodyEnd);
            String literal = source.firstLiteral(open, close < 0 ? bodyEnd : close);
            if (literal != null) {
                literals.add(literal);
            }
        }
        return literals.stream().allMatch(l -> l.startsWith(ToolConventions.ERROR_PREFIX));
    }

    private boolean isErrorCondition(Range condition) {
        String text = masked.substring(condition.start + 1, condition.end);
        if (NULL_CHECK.matcher(text).find()) {
            return true;
        }
        for (String name : restrictedParameters) {
            if (Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private Set<String> validationGuards(List<Range> ifs, Delegation delegation) {
        Set<String> mentioned = new HashSet<>();
        for (Range condition : ifs) {
            if (delegation.call >= 0 && condition.start > delegation.call) {
                continue;
            }
            Range branch = branchAfter(condition.end);
            boolean rejects =
                    returnLiterals(branch, new HashSet<>()).stream()
                            .anyMatch(l -> l.startsWith(ToolConventions.ERROR_PREFIX));
            if (!rejects) {
                continue;
            }
            String text = masked.substring(condition.start + 1, condition.end);
            for (String name : parameterNames) {
                if (Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(text).find()) {
                    mentioned.add(name);
                }
            }
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String name : parameterNames) {
            if (mentioned.contains(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }
}
