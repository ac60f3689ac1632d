package io.patchbay.core.harness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.patchbay.core.runtime.DelegationHandle;
import io.patchbay.core.runtime.ToolContext;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class MockRegistryTest {

    @Test
    void shouldRecordCallsInArrivalOrder() {
        // Given
        MockRegistry registry =
                MockRegistry.from(
                        MockRegistryConfig.available()
                                .stub("transport", "set_tempo", MockBehavior.returns("Tempo set"))
                                .build());

        // When
        Object first = registry.handler("transport").call("set_tempo", Map.of("bpm", 120.0)).join();
        Object second = registry.direct().call("record", Map.of()).join();

        // Then
        assertThat(first).isEqualTo("Tempo set");
        assertThat(second).isNull();
        assertThat(registry.invocations())
                .containsExactly(
                        new Invocation("transport", "set_tempo", Map.of("bpm", 120.0)),
                        new Invocation(ToolContext.DIRECT_TARGET, "record", Map.of()));
    }

    @Test
    void shouldResolveNothingWhenUnavailable() {
        MockRegistry registry = MockRegistry.from(MockRegistryConfig.unavailable());

        assertThat(registry.handler("transport")).isNull();
        assertThat(registry.direct()).isNull();
        assertThat(registry.untouched()).isTrue();
    }

    @Test
    void shouldResolveOnlyKnownTargets() {
        MockRegistry registry =
                MockRegistry.from(
                        MockRegistryConfig.available().knownTargets(Set.of("transport")).build());

        assertThat(registry.handler("transport")).isNotNull();
        assertThat(registry.handler("mixer")).isNull();
        assertThat(registry.direct()).isNull();
    }

    @Test
    void shouldExposeOnlineFlagSeparatelyFromBuilderFactory() {
        // Given
        MockRegistryConfig online = MockRegistryConfig.available().build();
        MockRegistryConfig offline = MockRegistryConfig.unavailable();

        // Then
        assertThat(online.online()).isTrue();
        assertThat(online.resolves("transport")).isTrue();
        assertThat(offline.online()).isFalse();
        assertThat(offline.resolves("transport")).isFalse();
        assertThat(new MockRegistryConfig(true, Set.of(), Map.of(), null))
                .isEqualTo(online);
    }

    @Test
    void shouldPreferMostSpecificStub() {
        MockRegistryConfig config =
                MockRegistryConfig.available()
                        .stub("*", "*", MockBehavior.returns("any"))
                        .stub("*", "record", MockBehavior.returns("any target"))
                        .stub("track", "*", MockBehavior.returns("any method"))
                        .stub("track", "delete_track", MockBehavior.throwsSync("Locked"))
                        .build();

        assertThat(config.behaviorOf("track", "delete_track")).isEqualTo(MockBehavior.throwsSync("Locked"));
        assertThat(config.behaviorOf("track", "create_track")).isEqualTo(MockBehavior.returns("any method"));
        assertThat(config.behaviorOf("backend", "record")).isEqualTo(MockBehavior.returns("any target"));
        assertThat(config.behaviorOf("mixer", "mute")).isEqualTo(MockBehavior.returns("any"));
    }

    @Test
    void shouldFailAsynchronouslyOrSynchronously() {
        MockRegistry registry =
                MockRegistry.from(
                        MockRegistryConfig.available()
                                .stub("clip", "fire", MockBehavior.failsAsync("Slot empty"))
                                .stub("clip", "stop", MockBehavior.throwsSync("Handler crashed"))
                                .build());
        DelegationHandle clip = registry.handler("clip");

        CompletableFuture<Object> fire = clip.call("fire", Map.of());

        assertThat(fire).isCompletedExceptionally();
        assertThatThrownBy(fire::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(MockDelegationException.class)
                .hasRootCauseMessage("Slot empty");
        assertThatThrownBy(() -> clip.call("stop", Map.of()))
                .isInstanceOf(MockDelegationException.class)
                .hasMessage("Handler crashed");
        // Both calls are recorded before their behavior runs
        assertThat(registry.invocations()).hasSize(2);
    }

    @Test
    void shouldCancelHangingCalls() {
        MockRegistry registry =
                MockRegistry.from(MockRegistryConfig.available().fallback(MockBehavior.hangs()).build());

        CompletableFuture<Object> pending = registry.direct().call("record", Map.of());
        assertThat(pending).isNotDone();

        registry.cancelPending();

        assertThat(pending).isCancelled();
    }
}
