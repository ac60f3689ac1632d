package io.patchbay.core.convention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.patchbay.core.convention.ParameterDomain.Choice;
import io.patchbay.core.convention.ParameterDomain.NumericRange;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParameterDomainsTest {

    @Nested
    class Recognition {

        @Test
        void shouldParseParenthesizedRange() {
            assertThat(ParameterDomains.parse("Tempo in beats per minute (60-200)"))
                    .contains(new NumericRange(60, 200));
        }

        @Test
        void shouldParseRangePhrasings() {
            assertThat(ParameterDomains.parse("Velocity 0 to 127")).contains(new NumericRange(0, 127));
            assertThat(ParameterDomains.parse("Channel 1..16")).contains(new NumericRange(1, 16));
            assertThat(ParameterDomains.parse("Volume between 0.0 and 1.0"))
                    .contains(new NumericRange(0.0, 1.0));
        }

        @Test
        void shouldParseChoiceLists() {
            assertThat(ParameterDomains.parse("Note density (sparse, medium, dense)"))
                    .contains(new Choice(List.of("sparse", "medium", "dense")));
            assertThat(ParameterDomains.parse("Track type, one of: audio, midi, return"))
                    .contains(new Choice(List.of("audio", "midi", "return")));
            assertThat(ParameterDomains.parse("Mode (on | off)"))
                    .contains(new Choice(List.of("on", "off")));
        }

        @Test
        void shouldIgnoreExamplesAndSingletons() {
            assertThat(ParameterDomains.parse("Musical key (e.g. C, Am, F#m)")).isEmpty();
            assertThat(ParameterDomains.parse("Type of track (audio)")).isEmpty();
            assertThat(ParameterDomains.parse("Name for the track")).isEmpty();
            assertThat(ParameterDomains.parse(null)).isEmpty();
            assertThat(ParameterDomains.parse("  ")).isEmpty();
        }

        @Test
        void shouldIgnoreDefaultNote() {
            assertThat(ParameterDomains.parse("Track name (default: null)")).isEmpty();
            assertThat(ParameterDomains.parse("Length in bars (4-64) (default: 4)"))
                    .contains(new NumericRange(4, 64));
        }

        @Test
        void shouldPreferRangeOverChoice() {
            assertThat(ParameterDomains.parse("Level (low, high) between 1 and 3"))
                    .contains(new NumericRange(1, 3));
        }

        @Test
        void shouldDropDomainThatDoesNotFitType() {
            assertThat(ParameterDomains.forParameter("Tempo (60-200)", "String")).isEmpty();
            assertThat(ParameterDomains.forParameter("Mode (on, off)", "int")).isEmpty();
            assertThat(ParameterDomains.forParameter("Tempo (60-200)", "double")).isPresent();
        }
    }

    @Nested
    class Range {

        private final NumericRange range = new NumericRange(60, 200);

        @Test
        void shouldAcceptBoundsInclusive() {
            assertThat(range.accepts(60)).isTrue();
            assertThat(range.accepts(200.0)).isTrue();
            assertThat(range.accepts(201)).isFalse();
            assertThat(range.accepts("120")).isTrue();
            assertThat(range.accepts("fast")).isFalse();
        }

        @Test
        void shouldProduceTypedSamples() {
            assertThat(range.sampleValue("int")).isEqualTo(60);
            assertThat(range.sampleValue("double")).isEqualTo(60.0);
            assertThat(range.invalidValue("int")).isEqualTo(201);
            assertThat(range.invalidValue("long")).isEqualTo(201L);
        }

        @Test
        void shouldRenderConditionForPrimitiveAndBoxed() {
            assertThat(range.violationCondition("bpm", "double", false))
                    .isEqualTo("!(bpm >= 60 && bpm <= 200)");
            assertThat(range.violationCondition("bpm", "Double", false))
                    .isEqualTo("bpm == null || !(bpm >= 60 && bpm <= 200)");
            assertThat(range.violationCondition("bpm", "Double", true))
                    .isEqualTo("bpm != null && !(bpm >= 60 && bpm <= 200)");
        }

        @Test
        void shouldRejectNaNInValueAndInRenderedCondition() {
            // Given
            double bpm = Double.NaN;

            // Then
            assertThat(range.accepts(bpm)).isFalse();
            assertThat(range.rejects(bpm, false)).isTrue();
            assertThat(range.violationCondition("bpm", "double", false)).startsWith("!(");
        }

        @Test
        void shouldPickInvalidValueTheTypeCanHold() {
            // Given
            NumericRange wide = new NumericRange(0, 9999999999.0);

            // When
            Object invalid = wide.invalidValue("int");

            // Then
            assertThat(wide.fitsType("int")).isFalse();
            assertThat(wide.fitsType("long")).isTrue();
            assertThat(invalid).isEqualTo(-1);
            assertThat(wide.accepts(invalid)).isFalse();
            assertThat(wide.invalidValue("long")).isEqualTo(10000000000L);
        }

        @Test
        void shouldReportNoInvalidValueWhenRangeCoversType() {
            NumericRange everyByte = new NumericRange(-128, 127);
            NumericRange wider = new NumericRange(-1000, 1000);

            assertThat(everyByte.hasInvalidValue("byte")).isFalse();
            assertThat(wider.hasInvalidValue("byte")).isFalse();
            assertThat(everyByte.hasInvalidValue("int")).isTrue();
            assertThatThrownBy(() -> wider.invalidValue("Byte"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("every Byte value lies between -1000 and 1000");
        }

        @Test
        void shouldFormatMessageWithoutTrailingZero() {
            assertThat(range.violationMessage("bpm")).isEqualTo("Error: bpm must be between 60 and 200");
            assertThat(new NumericRange(0.5, 1.5).violationMessage("gain"))
                    .isEqualTo("Error: gain must be between 0.5 and 1.5");
        }

        @Test
        void shouldRejectNullUnlessAllowed() {
            assertThat(range.rejects(null, false)).isTrue();
            assertThat(range.rejects(null, true)).isFalse();
        }
    }

    @Nested
    class ChoiceSet {

        private final Choice choice = new Choice(List.of("sparse", "medium", "dense"));

        @Test
        void shouldMatchExactly() {
            assertThat(choice.accepts("medium")).isTrue();
            assertThat(choice.accepts("Medium")).isFalse();
            assertThat(choice.accepts(1)).isFalse();
        }

        @Test
        void shouldProduceSampleAndInvalidValue() {
            assertThat(choice.sampleValue("String")).isEqualTo("sparse");
            assertThat(choice.invalidValue("String")).isEqualTo("invalid_choice");
        }

        @Test
        void shouldRenderConditionAndMessage() {
            assertThat(choice.violationCondition("density", "String", true))
                    .isEqualTo("density != null && !List.of(\"sparse\", \"medium\", \"dense\").contains(density)");
            assertThat(choice.violationMessage("note_density"))
                    .isEqualTo("Error: note_density must be one of: sparse, medium, dense");
        }
    }
}
