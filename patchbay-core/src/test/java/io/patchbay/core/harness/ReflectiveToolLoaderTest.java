package io.patchbay.core.harness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.McpTool;
import io.patchbay.core.runtime.Param;
import io.patchbay.core.runtime.ToolArguments;
import io.patchbay.core.runtime.ToolContext;
import io.patchbay.core.runtime.ToolFunction;
import io.patchbay.core.runtime.ToolResults;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReflectiveToolLoaderTest {

    public static class MixerTools {

        @McpTool(name = "set_volume")
        public CompletableFuture<String> setVolume(
                ToolContext context, double level, @Param(defaultValue = "\"master\"") String bus) {
            DelegationHandle handler = context.handler("mixer");
            if (handler == null) {
                return CompletableFuture.completedFuture("Error: Server not initialized");
            }
            return handler.call("set_volume", ToolArguments.of("level", level, "bus", bus))
                    .thenApply(result -> ToolResults.firstText(result, "Set volume completed"));
        }

        @McpTool
        public String muteAll(ToolContext context) {
            return "Muted";
        }

        @McpTool(name = "explode")
        public CompletableFuture<String> explode(ToolContext context) {
            throw new IllegalStateException("boom");
        }

        public String describe() {
            return "mixer";
        }
    }

    public static class ClashingTools {

        @McpTool(name = "stop")
        public String stop(ToolContext context) {
            return "Stopped";
        }

        @McpTool(name = "stop")
        public String halt(ToolContext context) {
            return "Halted";
        }
    }

    private Map<String, ToolFunction> tools;
    private MockRegistry registry;

    @BeforeEach
    void setUp() {
        tools = ReflectiveToolLoader.load(new MixerTools());
        registry =
                MockRegistry.from(
                        MockRegistryConfig.available()
                                .stub("mixer", "set_volume", MockBehavior.returns("Volume set"))
                                .build());
    }

    @Test
    void shouldLoadMarkedMethodsOnly() {
        assertThat(tools).containsOnlyKeys("explode", "mute_all", "set_volume");
    }

    @Test
    void shouldBindArgumentsAndDefaults() {
        // When
        String result = tools.get("set_volume").invoke(registry, Map.of("level", 1)).join();

        // Then
        assertThat(result).isEqualTo("Volume set");
        assertThat(registry.invocations())
                .containsExactly(
                        new Invocation(
                                "mixer", "set_volume", Map.of("level", 1.0, "bus", "master")));
    }

    @Test
    void shouldWrapPlainResults() {
        assertThat(tools.get("mute_all").invoke(registry, Map.of()).join()).isEqualTo("Muted");
    }

    @Test
    void shouldRethrowToolExceptions() {
        assertThatThrownBy(() -> tools.get("explode").invoke(registry, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void shouldRejectMissingRequiredArgument() {
        assertThatThrownBy(() -> tools.get("set_volume").invoke(registry, Map.of("bus", "aux")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required argument 'level' for set_volume");
        assertThat(registry.untouched()).isTrue();
    }

    @Test
    void shouldRejectDuplicateToolNames() {
        assertThatThrownBy(() -> ReflectiveToolLoader.load(new ClashingTools()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Duplicate tool name: stop");
    }
}
