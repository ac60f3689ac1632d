package io.patchbay.core.extract;

/// Java source with a parallel "masked" view.
///
/// In the masked view the contents of comments, string literals, text blocks and char
/// literals are replaced by spaces (line breaks kept), while quote characters stay in
/// place. Offsets are identical in both views, so structure is searched in the masked
/// view and literal or comment text is read back from the original.
///
/// @implNote Immutable; safe to share between threads.
final class SourceText {

    private final String original;
    private final String masked;

    SourceText(String original) {
        this.original = original;
        this.masked = mask(original);
    }

    String original() {
        return original;
    }

    String masked() {
        return masked;
    }

    /// Returns the 1-based line of an offset.
    int lineOf(int offset) {
        int line = 1;
        int end = Math.min(offset, original.length());
        for (int i = 0; i < end; i++) {
            if (original.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /// Finds the delimiter closing the one at `openIndex`, counting nesting in the masked view.
    ///
    /// @param openIndex offset of `(`, `{`, `[` or `<`
    /// @param limit exclusive search bound
    /// @return offset of the matching delimiter, or -1 if unbalanced
    int matching(int openIndex, int limit) {
        char open = masked.charAt(openIndex);
        char close =
                switch (open) {
                    case '(' -> ')';
                    case '{' -> '}';
                    case '[' -> ']';
                    case '<' -> '>';
                    default -> throw new IllegalArgumentException("not a delimiter: " + open);
                };
        int depth = 0;
        for (int i = openIndex; i < limit; i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /// Returns the raw content of the string literal whose opening quote is at `quoteIndex`.
    ///
    /// @return literal content without quotes and without unescaping, or null if no literal starts there
    String literalAt(int quoteIndex) {
        if (quoteIndex < 0 || quoteIndex >= masked.length() || masked.charAt(quoteIndex) != '"') {
            return null;
        }
        if (masked.startsWith("\"\"\"", quoteIndex)) {
            int end = masked.indexOf("\"\"\"", quoteIndex + 3);
            return end < 0 ? null : original.substring(quoteIndex + 3, end);
        }
        int end = masked.indexOf('"', quoteIndex + 1);
        return end < 0 ? null : original.substring(quoteIndex + 1, end);
    }

    /// Returns the content of the first string literal in `[from, to)`, or null.
    String firstLiteral(int from, int to) {
        int quote = masked.indexOf('"', from);
        if (quote < 0 || quote >= to) {
            return null;
        }
        return literalAt(quote);
    }

    /// Returns the index after the statement starting at `from`: the first `;` outside any
    /// parentheses, brackets or braces, or `limit`.
    int statementEnd(int from, int limit) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (c == ';' && depth == 0) {
                return i + 1;
            }
        }
        return limit;
    }

    /// Returns the first non-whitespace offset at or after `from` in the masked view.
    int skipWhitespace(int from) {
        int i = from;
        while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String mask(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                int end = source.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                blank(source, i, stop, out);
                i = stop;
            } else if (source.startsWith("\"\"\"", i)) {
                int end = source.indexOf("\"\"\"", i + 3);
                int stop = end < 0 ? n : end;
                out.append("\"\"\"");
                blank(source, i + 3, stop, out);
                if (end >= 0) {
                    out.append("\"\"\"");
                    i = end + 3;
                } else {
                    i = n;
                }
            } else if (c == '"' || c == '\'') {
                out.append(c);
                i++;
                while (i < n && source.charAt(i) != c && source.charAt(i) != '\n') {
                    if (source.charAt(i) == '\\' && i + 1 < n) {
                        out.append("  ");
                        i += 2;
                    } else {
                        out.append(' ');
                        i++;
                    }
                }
                if (i < n && source.charAt(i) == c) {
                    out.append(c);
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static void blank(String source, int from, int to, StringBuilder out) {
        for (int j = from; j < to; j++) {
            out.append(source.charAt(j) == '\n' ? '\n' : ' ');
        }
    }
}
