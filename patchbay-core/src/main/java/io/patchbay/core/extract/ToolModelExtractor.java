package io.patchbay.core.extract;

import io.patchbay.core.convention.ParameterDomains;
import io.patchbay.core.convention.ToolConventions;
import io.patchbay.core.extract.BodyInspector.BodyFacts;
import io.patchbay.core.model.Docstring;
import io.patchbay.core.model.ToolDefinition;
import io.patchbay.core.model.ToolParameter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Extracts {@link ToolDefinition}s from Java source text.
///
/// Extraction is structural: comments and literals are masked, method headers are
/// matched, delimiters are balanced and the body is inspected for its surface shape.
/// No source is compiled or executed.
///
/// A method is a candidate when it is not private and either carries a marker-like
/// annotation (`@McpTool`, `@Tool`, ...) or takes a `ToolContext` as its first parameter.
/// The second form catches tools whose marker was forgotten.
///
/// ### Contracts
/// - **Precondition**: source text is not null
/// - **Postcondition**: results follow declaration order
/// - **Invariant**: one malformed candidate never hides its neighbours
///
/// @implNote Stateless and thread-safe.
/// @see BodyInspector for body facts
public class ToolModelExtractor {

    private static final Logger logger = Logger.getLogger(ToolModelExtractor.class.getName());

    private static final Pattern HEADER =
            Pattern.compile(
                    "(?<![\\w.@$])(?<type>[A-Za-z_][\\w.]*(?:\\s*<[^;{}()]*>)?(?:\\s*\\[\\s*\\])*)"
                            + "\\s+(?<name>[A-Za-z_]\\w*)\\s*\\(");

    private static final Pattern ANNOTATION = Pattern.compile("@\\s*([A-Za-z_][\\w.]*)");

    private static final Pattern NAME_ATTRIBUTE = Pattern.compile("^\\s*name\\s*=\\s*\"$");

    private static final Pattern PRIVATE = Pattern.compile("\\bprivate\\b");

    private static final Set<String> NOT_A_TYPE =
            Set.of(
                    "new", "return", "throw", "else", "case", "yield", "record", "class",
                    "interface", "enum", "assert", "public", "protected", "private", "static",
                    "final", "abstract", "synchronized", "native", "default", "transient",
                    "volatile", "strictfp", "sealed", "package", "import");

    private static final Set<String> NOT_A_NAME =
            Set.of(
                    "if", "for", "while", "switch", "catch", "synchronized", "return", "new",
                    "super", "this", "try", "do", "else");

    /// Extracts the single tool of a one-tool unit.
    ///
    /// @param unitId identifier used in locations and errors, not null
    /// @param source unit source text, not null
    /// @return the definition, never null
    /// @throws ToolExtractionException if the unit holds no candidate, more than one, or a
    ///     malformed one
    public ToolDefinition extract(String unitId, String source) throws ToolExtractionException {
        List<ExtractionResult> results = extractAll(unitId, source);
        if (results.isEmpty()) {
            throw new ToolExtractionException(unitId, "no tool method found");
        }
        if (results.size() > 1) {
            throw new ToolExtractionException(
                    unitId, "expected exactly one tool method, found " + results.size());
        }
        ExtractionResult only = results.get(0);
        if (only instanceof ExtractionResult.Failed failed) {
            throw failed.error();
        }
        return ((ExtractionResult.Extracted) only).definition();
    }

    /// Reads a file and extracts every candidate in it. The unit id is the file name.
    ///
    /// @param file source file, not null
    /// @return results in declaration order, never null
    /// @throws ToolExtractionException if the file cannot be read
    public List<ExtractionResult> extractAll(Path file) throws ToolExtractionException {
        String unitId = file.getFileName().toString();
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            throw new ToolExtractionException(unitId, "cannot read source: " + e.getMessage(), e);
        }
        return extractAll(unitId, source);
    }

    /// Extracts every candidate of a unit.
    ///
    /// @param unitId identifier used in locations and errors, not null
    /// @param source unit source text, not null
    /// @return results in declaration order, empty when the unit has no candidate
    public List<ExtractionResult> extractAll(String unitId, String source) {
        SourceText text = new SourceText(source);
        String masked = text.masked();
        List<ExtractionResult> results = new ArrayList<>();

        Matcher header = HEADER.matcher(masked);
        int pos = 0;
        while (pos < masked.length() && header.find(pos)) {
            String type = header.group("type").strip();
            String name = header.group("name");
            int open = header.end() - 1;
            pos = header.end();

            if (NOT_A_TYPE.contains(type) || NOT_A_NAME.contains(name)) {
                continue;
            }

            int declarationStart = declarationStart(text, header.start("type"));
            String prefix = masked.substring(declarationStart, header.start("type"));
            List<AnnotationUse> annotations = annotations(text, declarationStart, header.start("type"));
            int close = text.matching(open, masked.length());

            if (close < 0) {
                if (isCandidate(prefix, annotations, null)) {
                    results.add(failed(unitId, "unbalanced parentheses in signature of " + name));
                }
                break;
            }

            List<ParameterSlot> slots = parameterSlots(text, open, close);
            String firstType = slots.isEmpty() ? null : slots.get(0).type;
            boolean candidate = isCandidate(prefix, annotations, firstType);

            int after = skipThrows(text, close + 1);
            if (after >= masked.length() || (masked.charAt(after) != '{' && masked.charAt(after) != ';')) {
                continue;
            }
            if (masked.charAt(after) == ';') {
                if (candidate) {
                    results.add(failed(unitId, "tool method " + name + " has no body"));
                }
                pos = after + 1;
                continue;
            }
            int bodyEnd = text.matching(after, masked.length());
            if (bodyEnd < 0) {
                if (candidate) {
                    results.add(failed(unitId, "unbalanced braces in body of " + name));
                }
                break;
            }
            pos = bodyEnd + 1;
            if (!candidate) {
                continue;
            }

            ToolDefinition definition =
                    buildDefinition(
                            unitId, text, type, name, header.start("name"), declarationStart,
                            annotations, slots, after, bodyEnd);
            logger.fine("Extracted tool " + definition.name() + " at " + definition.location());
            results.add(new ExtractionResult.Extracted(definition));
        }
        return List.copyOf(results);
    }

    private ExtractionResult failed(String unitId, String message) {
        logger.warning("Unextractable tool in " + unitId + ": " + message);
        return new ExtractionResult.Failed(new ToolExtractionException(unitId, message));
    }

    private ToolDefinition buildDefinition(
            String unitId,
            SourceText text,
            String type,
            String methodName,
            int nameStart,
            int declarationStart,
            List<AnnotationUse> annotations,
            List<ParameterSlot> slots,
            int bodyStart,
            int bodyEnd) {

        String contextName = null;
        List<ToolParameter> parameters = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            ParameterSlot slot = slots.get(i);
            if (i == 0 && isContextType(slot.type)) {
                contextName = slot.name;
                continue;
            }
            parameters.add(
                    slot.defaultValue != null
                            ? ToolParameter.optional(slot.name, slot.type, slot.defaultValue)
                            : ToolParameter.required(slot.name, slot.type));
        }

        AnnotationUse marker =
                annotations.stream()
                        .filter(a -> ToolConventions.isMarkerLike(a.name))
                        .findFirst()
                        .orElse(null);
        String toolName =
                marker != null && marker.nameAttribute != null && !marker.nameAttribute.isBlank()
                        ? marker.nameAttribute
                        : ToolConventions.toSnakeCase(methodName);

        String rawType = rawType(type);
        boolean async = ToolConventions.isAsyncType(rawType);
        String valueType = async ? typeArgument(type) : type;
        boolean plainText = "String".equals(valueType) || "java.lang.String".equals(valueType);

        Docstring docstring = DocCommentParser.parseBefore(text, declarationStart);
        List<String> parameterNames = parameters.stream().map(ToolParameter::name).toList();
        Set<String> restricted =
                parameters.stream()
                        .filter(
                                p ->
                                        ParameterDomains.forParameter(
                                                        docstring.describe(p.name()), p.declaredType())
                                                .isPresent())
                        .map(ToolParameter::name)
                        .collect(Collectors.toSet());
        BodyFacts facts =
                new BodyInspector(text, bodyStart, bodyEnd, contextName, parameterNames, restricted)
                        .inspect();

        return new ToolDefinition(
                toolName,
                methodName,
                unitId + ":" + text.lineOf(nameStart),
                async,
                annotations.stream().anyMatch(ToolModelExtractor::isCanonicalMarker),
                parameters,
                plainText,
                docstring,
                facts.shape(),
                facts.guards(),
                facts.delegation());
    }

    private static boolean isCandidate(String prefix, List<AnnotationUse> annotations, String firstType) {
        if (PRIVATE.matcher(prefix).find()) {
            return false;
        }
        boolean marked = annotations.stream().anyMatch(a -> ToolConventions.isMarkerLike(a.name));
        return marked || (firstType != null && isContextType(firstType));
    }

    private static boolean isContextType(String type) {
        return ToolConventions.CONTEXT_TYPE.equals(simpleName(rawType(type)));
    }

    /// Canonical marker: exactly `McpTool`, bare or with a snake_case `name` attribute.
    private static boolean isCanonicalMarker(AnnotationUse annotation) {
        if (!ToolConventions.MARKER.equals(simpleName(annotation.name))) {
            return false;
        }
        if (annotation.arguments == null || annotation.arguments.isBlank()) {
            return true;
        }
        return annotation.nameAttribute != null && ToolConventions.isSnakeCase(annotation.nameAttribute);
    }

    // --- header pieces ---

    private record AnnotationUse(String name, String arguments, String nameAttribute) {}

    private record ParameterSlot(String type, String name, String defaultValue) {}

    /// Walks back from the return type over modifiers, annotations and type parameters.
    private static int declarationStart(SourceText text, int typeStart) {
        String masked = text.masked();
        int i = typeStart - 1;
        int parens = 0;
        while (i >= 0) {
            char c = masked.charAt(i);
            if (c == ')') {
                parens++;
            } else if (c == '(') {
                parens--;
            } else if (parens == 0 && (c == ';' || c == '{' || c == '}')) {
                break;
            }
            i--;
        }
        return text.skipWhitespace(i + 1);
    }

    private static List<AnnotationUse> annotations(SourceText text, int from, int to) {
        String masked = text.masked();
        List<AnnotationUse> uses = new ArrayList<>();
        Matcher matcher = ANNOTATION.matcher(masked).region(from, to);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (name.equals("interface")) {
                continue;
            }
            int open = text.skipWhitespace(matcher.end());
            String arguments = null;
            String nameAttribute = null;
            if (open < to && masked.charAt(open) == '(') {
                int close = text.matching(open, to);
                if (close < 0) {
                    break;
                }
                arguments = text.original().substring(open + 1, close);
                nameAttribute = stringAttribute(text, open + 1, close);
                matcher.region(close + 1, to);
            }
            uses.add(new AnnotationUse(name, arguments, nameAttribute));
        }
        return uses;
    }

    /// Returns the literal of a `name = "..."` attribute inside `[from, to)`, or null.
    private static String stringAttribute(SourceText text, int from, int to) {
        String masked = text.masked();
        int quote = masked.indexOf('"', from);
        if (quote < 0 || quote >= to) {
            return null;
        }
        if (!NAME_ATTRIBUTE.matcher(masked.substring(from, quote + 1)).matches()) {
            return null;
        }
        return text.literalAt(quote);
    }

    private static int skipThrows(SourceText text, int from) {
        String masked = text.masked();
        int at = text.skipWhitespace(from);
        if (!masked.startsWith("throws", at)) {
            return at;
        }
        while (at < masked.length() && masked.charAt(at) != '{' && masked.charAt(at) != ';') {
            at++;
        }
        return at;
    }

    private static List<ParameterSlot> parameterSlots(SourceText text, int open, int close) {
        String masked = text.masked();
        List<ParameterSlot> slots = new ArrayList<>();
        int depth = 0;
        int start = open + 1;
        for (int i = open + 1; i <= close; i++) {
            char c = masked.charAt(i);
            if (c == '<' || c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == '>' || c == ')' || c == ']' || c == '}') && i < close) {
                depth--;
            } else if ((c == ',' && depth == 0) || i == close) {
                ParameterSlot slot = parameterSlot(text, start, i);
                if (slot != null) {
                    slots.add(slot);
                }
                start = i + 1;
            }
        }
        return slots;
    }

    private static ParameterSlot parameterSlot(SourceText text, int from, int to) {
        String masked = text.masked();
        String defaultValue = null;
        StringBuilder declaration = new StringBuilder();
        int i = from;
        while (i < to) {
            char c = masked.charAt(i);
            if (c == '@') {
                Matcher annotation = ANNOTATION.matcher(masked).region(i, to);
                if (!annotation.lookingAt()) {
                    i++;
                    continue;
                }
                int next = text.skipWhitespace(annotation.end());
                if (next < to && masked.charAt(next) == '(') {
                    int close = text.matching(next, to);
                    if (close < 0) {
                        return null;
                    }
                    if (ToolConventions.PARAM_ANNOTATION.equals(simpleName(annotation.group(1)))) {
                        String literal = text.firstLiteral(next, close);
                        defaultValue = literal != null ? unescape(literal) : null;
                    }
                    i = close + 1;
                } else {
                    i = annotation.end();
                }
                continue;
            }
            declaration.append(c);
            i++;
        }
        String[] tokens =
                declaration.toString().replaceAll("\\bfinal\\b", " ").strip().split("\\s+(?![^<]*>)");
        if (tokens.length < 2 || tokens[0].isEmpty()) {
            return null;
        }
        String name = tokens[tokens.length - 1];
        String type = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1))
                .replaceAll("\\s+", "");
        type = type.replace(",", ", ");
        return new ParameterSlot(type, name, defaultValue);
    }

    private static String unescape(String literal) {
        StringBuilder out = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < literal.length()) {
                char next = literal.charAt(++i);
                switch (next) {
                    case 'n' -> out.append('\n');
                    case 't' -> out.append('\t');
                    case 'r' -> out.append('\r');
                    case '0' -> out.append('\0');
                    default -> out.append(next);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String rawType(String type) {
        int generic = type.indexOf('<');
        return (generic < 0 ? type : type.substring(0, generic)).strip();
    }

    private static String simpleName(String qualified) {
        return qualified.substring(qualified.lastIndexOf('.') + 1);
    }

    private static String typeArgument(String type) {
        int open = type.indexOf('<');
        int close = type.lastIndexOf('>');
        if (open < 0 || close < open) {
            return "";
        }
        return type.substring(open + 1, close).strip();
    }
}
