package io.patchbay.core.convention;

import io.patchbay.core.convention.ParameterDomain.Choice;
import io.patchbay.core.convention.ParameterDomain.NumericRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Recognizes restricted domains in parameter descriptions.
///
/// Best-effort heuristic over prose. Recognized phrasings:
/// - numeric ranges: `60-200`, `(4-64)`, `0 to 127`, `1..16`, `between 60 and 200`
/// - choice sets: `(audio, midi, return)`, `(sparse | medium | dense)`, `one of: a, b, c`
///
/// Parenthesized lists introduced by `e.g.`, `i.e.`, `for example` or `default` are examples,
/// not domains. A `(default: ...)` note appended by the generator is ignored. Ranges win
/// over choices when both appear.
///
/// @implNote Stateless; safe to call from any thread.
public final class ParameterDomains {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";

    private static final Pattern DEFAULT_NOTE = Pattern.compile("\\(\\s*default:[^)]*\\)");

    private static final Pattern BETWEEN =
            Pattern.compile("(?i)between\\s+" + NUMBER + "\\s+and\\s+" + NUMBER);

    private static final Pattern SPAN =
            Pattern.compile(
                    "(?<![\\w.])" + NUMBER + "\\s*(?:-|\u2013|\\.\\.|\\bto\\b)\\s*" + NUMBER
                            + "(?![\\w.])");

    private static final Pattern ONE_OF = Pattern.compile("(?i)\\bone of:?\\s*([^.;()]+)");

    private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^()]+)\\)");

    private static final Pattern EXAMPLE_INTRO =
            Pattern.compile("(?i)^\\s*(?:e\\.g\\.?|i\\.e\\.?|for example|eg\\b|default\\b).*");

    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*(?:,|\\||/|\\bor\\b)\\s*");

    private static final Pattern CHOICE_TOKEN = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private ParameterDomains() {}

    /// Parses a domain from a parameter description.
    ///
    /// @param description parameter description, may be null
    /// @return recognized domain, or empty
    public static Optional<ParameterDomain> parse(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        String text = DEFAULT_NOTE.matcher(description).replaceAll(" ");

        Optional<ParameterDomain> range = parseRange(text);
        if (range.isPresent()) {
            return range;
        }
        return parseChoice(text);
    }

    /// Parses a domain and keeps it only when it can restrict the given Java type.
    ///
    /// @param description parameter description, may be null
    /// @param javaType declared Java type, not null
    /// @return applicable domain, or empty
    public static Optional<ParameterDomain> forParameter(String description, String javaType) {
        return parse(description).filter(domain -> domain.appliesTo(javaType));
    }

    private static Optional<ParameterDomain> parseRange(String text) {
        for (Pattern pattern : List.of(BETWEEN, SPAN)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                double low = Double.parseDouble(matcher.group(1));
                double high = Double.parseDouble(matcher.group(2));
                if (low <= high) {
                    return Optional.of(new NumericRange(low, high));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<ParameterDomain> parseChoice(String text) {
        Matcher oneOf = ONE_OF.matcher(text);
        if (oneOf.find()) {
            Optional<ParameterDomain> choice = toChoice(oneOf.group(1));
            if (choice.isPresent()) {
                return choice;
            }
        }
        Matcher parenthesized = PARENTHESIZED.matcher(text);
        while (parenthesized.find()) {
            Optional<ParameterDomain> choice = toChoice(parenthesized.group(1));
            if (choice.isPresent()) {
                return choice;
            }
        }
        return Optional.empty();
    }

    private static Optional<ParameterDomain> toChoice(String list) {
        if (EXAMPLE_INTRO.matcher(list).matches()) {
            return Optional.empty();
        }
        List<String> values = new ArrayList<>();
        for (String raw : LIST_SEPARATOR.split(list.strip())) {
            String token = stripQuotes(raw.strip());
            if (token.isEmpty()) {
                continue;
            }
            if (!CHOICE_TOKEN.matcher(token).matches()) {
                return Optional.empty();
            }
            if (!values.contains(token)) {
                values.add(token);
            }
        }
        return values.size() >= 2 ? Optional.of(new Choice(values)) : Optional.empty();
    }

    private static String stripQuotes(String token) {
        if (token.length() >= 2
                && (token.startsWith("'") && token.endsWith("'")
                        || token.startsWith("\"") && token.endsWith("\""))) {
            return token.substring(1, token.length() - 1);
        }
        return token;
    }
}
