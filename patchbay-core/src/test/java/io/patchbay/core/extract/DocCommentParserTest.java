package io.patchbay.core.extract;

import static org.assertj.core.api.Assertions.assertThat;

import io.patchbay.core.model.Docstring;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocCommentParserTest {

    @Test
    void shouldParseMarkdownComment() {
        String code =
                """
                class T {
                    /// Set the session tempo
                    ///
                    /// @param bpm Tempo in beats per minute
                    ///     (60-200)
                    @McpTool
                    public void f() {}
                }
                """;
        SourceText text = new SourceText(code);

        Docstring docstring = DocCommentParser.parseBefore(text, code.indexOf("@McpTool"));

        assertThat(docstring.summary()).isEqualTo("Set the session tempo");
        assertThat(docstring.argSections())
                .containsEntry("bpm", "Tempo in beats per minute (60-200)");
    }

    @Test
    void shouldParseClassicComment() {
        String code =
                """
                /**
                 * Create a track.
                 * Uses the track handler.
                 *
                 * @param name Track name
                 * @return status text
                 */
                public void f() {}
                """;
        SourceText text = new SourceText(code);

        Docstring docstring = DocCommentParser.parseBefore(text, code.indexOf("public"));

        assertThat(docstring.summary()).isEqualTo("Create a track. Uses the track handler.");
        assertThat(docstring.argSections()).containsOnlyKeys("name");
    }

    @Test
    void shouldIgnorePlainBlockComment() {
        String code = "/* not a doc */\npublic void f() {}";

        Docstring docstring =
                DocCommentParser.parseBefore(new SourceText(code), code.indexOf("public"));

        assertThat(docstring).isEqualTo(Docstring.empty());
    }

    @Test
    void shouldReturnEmptyWithoutComment() {
        String code = "class T {\n    public void f() {}\n}";

        Docstring docstring =
                DocCommentParser.parseBefore(new SourceText(code), code.indexOf("public"));

        assertThat(docstring.hasSummary()).isFalse();
        assertThat(docstring.argSections()).isEmpty();
    }

    @Test
    void shouldKeepEmptyParamDescription() {
        Docstring docstring = DocCommentParser.parse(List.of(" Summary", " @param bpm"));

        assertThat(docstring.argSections()).containsEntry("bpm", "");
        assertThat(docstring.describe("bpm")).isNull();
    }
}
