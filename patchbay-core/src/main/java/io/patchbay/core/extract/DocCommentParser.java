package io.patchbay.core.extract;

import io.patchbay.core.model.Docstring;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reads the doc comment preceding a declaration.
///
/// Accepts both Markdown comments (consecutive `///` lines) and classic `/** ... */`
/// blocks. The summary is the first paragraph before any blank line or block tag;
/// `@param` entries may continue on following lines.
final class DocCommentParser {

    private static final Pattern PARAM_TAG = Pattern.compile("^@param\\s+(\\w+)\\s*(.*)$");

    private DocCommentParser() {}

    /// Parses the doc comment that ends right before `declarationStart`.
    ///
    /// @param source the unit, not null
    /// @param declarationStart offset of the first annotation or modifier
    /// @return parsed docstring, {@link Docstring#empty()} when there is no doc comment
    static Docstring parseBefore(SourceText source, int declarationStart) {
        List<String> lines = commentLines(source.original(), declarationStart);
        if (lines == null) {
            return Docstring.empty();
        }
        return parse(lines);
    }

    static Docstring parse(List<String> lines) {
        StringBuilder summary = new StringBuilder();
        Map<String, String> params = new LinkedHashMap<>();
        boolean inSummary = true;
        String currentParam = null;

        for (String raw : lines) {
            String line = raw.strip();
            if (line.startsWith("@")) {
                inSummary = false;
                Matcher param = PARAM_TAG.matcher(line);
                if (param.matches()) {
                    currentParam = param.group(1);
                    params.put(currentParam, param.group(2).strip());
                } else {
                    currentParam = null;
                }
                continue;
            }
            if (line.isEmpty()) {
                if (summary.length() > 0) {
                    inSummary = false;
                }
                currentParam = null;
                continue;
            }
            if (currentParam != null) {
                String joined = (params.get(currentParam) + " " + line).strip();
                params.put(currentParam, joined);
            } else if (inSummary) {
                if (summary.length() > 0) {
                    summary.append(' ');
                }
                summary.append(line);
            }
        }
        return new Docstring(summary.toString(), params);
    }

    /// Collects the content lines of the comment ending right before `end`, or null.
    private static List<String> commentLines(String text, int end) {
        int i = end - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        if (i < 1) {
            return null;
        }
        if (text.charAt(i) == '/' && text.charAt(i - 1) == '*') {
            int start = text.lastIndexOf("/*", i - 2);
            if (start < 0 || !text.startsWith("/**", start)) {
                return null;
            }
            String body = text.substring(start + 3, i - 1);
            List<String> lines = new ArrayList<>();
            for (String line : body.split("\n", -1)) {
                String stripped = line.strip();
                if (stripped.startsWith("*")) {
                    stripped = stripped.substring(1);
                }
                lines.add(stripped);
            }
            return lines;
        }

        List<String> reversed = new ArrayList<>();
        int lineEnd = i + 1;
        while (lineEnd > 0) {
            int lineStart = text.lastIndexOf('\n', lineEnd - 1) + 1;
            String line = text.substring(lineStart, lineEnd).strip();
            if (!line.startsWith("///")) {
                break;
            }
            reversed.add(line.substring(3));
            lineEnd = lineStart - 1;
            if (lineEnd < 0) {
                break;
            }
        }
        if (reversed.isEmpty()) {
            return null;
        }
        List<String> lines = new ArrayList<>(reversed.size());
        for (int j = reversed.size() - 1; j >= 0; j--) {
            lines.add(reversed.get(j));
        }
        return lines;
    }
}
