package com.workforce.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RuleContext")
class RuleContextTest {

    @Nested
    @DisplayName("Route values")
    class RouteValues {

        private final RuleContext context =
                RuleContext.of(Map.of("id", " 42 ", "slug", "abc", "blank", "  "), Runnable::run);

        @Test
        @DisplayName("parses a numeric route id")
        void numericId() {
            assertThat(context.routeId("id")).hasValue(42L);
        }

        @Test
        @DisplayName("malformed and absent ids are empty")
        void malformedOrAbsent() {
            assertThat(context.routeId("slug")).isEmpty();
            assertThat(context.routeId("missing")).isEmpty();
            assertThat(context.routeId("blank")).isEmpty();
        }

        @Test
        @DisplayName("raw values are trimmed")
        void rawValue() {
            assertThat(context.routeValue("slug")).contains("abc");
            assertThat(context.routeValue("blank")).isEmpty();
        }

        @Test
        @DisplayName("empty context carries no route values")
        void emptyContext() {
            assertThat(RuleContext.empty().routeValue("id")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("runs the lookup on the executor")
        void runsOnExecutor() {
            var used = new AtomicBoolean();
            var context = RuleContext.of(Map.of(), task -> {
                used.set(true);
                task.run();
            });

            assertThat(context.supplyAsync(() -> "found").join()).isEqualTo("found");
            assertThat(used).isTrue();
        }

        @Test
        @DisplayName("a cancelled context does not start new lookups")
        void cancelledSkipsLookup() {
            var ran = new AtomicBoolean();
            var context = RuleContext.empty();
            context.cancel();

            assertThatThrownBy(() -> context.supplyAsync(() -> ran.getAndSet(true)).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(CancellationException.class);
            assertThat(ran).isFalse();
            assertThat(context.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("rejects a null executor")
        void rejectsNullExecutor() {
            assertThatThrownBy(() -> RuleContext.of(Map.of(), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
