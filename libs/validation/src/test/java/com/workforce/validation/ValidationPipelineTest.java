package com.workforce.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ValidationPipeline}: the gate that decides whether a handler runs.
 *
 * <p>WHY: The handler must observe only requests whose every payload passed every rule. These
 * tests pin that guarantee with a side-effect counter on the handler.
 */
@DisplayName("ValidationPipeline")
class ValidationPipelineTest {

    record Paging(Integer pageNumber, Integer pageSize) {}

    record Note(String text) {}

    record Unchecked(String anything) {}

    static class PagingValidator extends AbstractValidator<Paging> {
        PagingValidator() {
            super(Paging.class);
            ruleFor("PageNumber", Paging::pageNumber)
                    .must(Rules.atLeast(1), "Page number must be set to a positive non-zero integer.");
            ruleFor("PageSize", Paging::pageSize)
                    .must(Rules.atLeast(1), "You must return at least one record.")
                    .must(Rules.atMost(100), "You cannot return more than 100 records.");
        }
    }

    static class NoteValidator extends AbstractValidator<Note> {
        NoteValidator() {
            super(Note.class);
            ruleFor("Text", Note::text).must(Rules.notEmpty(), "Text is required.");
        }
    }

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private final ValidationPipeline pipeline = new ValidationPipeline(
            new ValidatorRegistry(List.of(new PagingValidator(), new NoteValidator())));

    @Nested
    @DisplayName("Gate")
    class Gate {

        @Test
        @DisplayName("handler is never invoked when one rule is violated")
        void handlerNotInvokedOnViolation() {
            var handlerCalls = new AtomicInteger();

            String result = pipeline.gate(
                    List.of(new Paging(1, 101)),
                    RuleContext.empty(),
                    () -> {
                        handlerCalls.incrementAndGet();
                        return "handled";
                    },
                    outcome -> "rejected:" + outcome.errorCount());

            assertThat(result).isEqualTo("rejected:1");
            assertThat(handlerCalls).hasValue(0);
        }

        @Test
        @DisplayName("handler runs exactly once when every payload is valid")
        void handlerInvokedWhenValid() {
            var handlerCalls = new AtomicInteger();

            String result = pipeline.gate(
                    List.of(new Paging(1, 10), new Note("hello")),
                    RuleContext.empty(),
                    () -> {
                        handlerCalls.incrementAndGet();
                        return "handled";
                    },
                    outcome -> "rejected");

            assertThat(result).isEqualTo("handled");
            assertThat(handlerCalls).hasValue(1);
        }

        @Test
        @DisplayName("handler is not invoked when a rule cannot be evaluated")
        void handlerNotInvokedOnFault() {
            var handlerCalls = new AtomicInteger();
            var faulty = new ValidationPipeline(new ValidatorRegistry(List.of(new FaultyNoteValidator())));

            assertThatThrownBy(() -> faulty.gate(
                    List.of(new Note("x")),
                    RuleContext.empty(),
                    handlerCalls::incrementAndGet,
                    outcome -> -1))
                    .isInstanceOf(RuleEvaluationException.class);
            assertThat(handlerCalls).hasValue(0);
        }
    }

    @Nested
    @DisplayName("Outcome")
    class Outcome {

        @Test
        @DisplayName("payloads without a validator pass")
        void unvalidatedPayloadPasses() {
            var outcome = pipeline.validate(List.of(new Unchecked("x")), RuleContext.empty());

            assertThat(outcome.valid()).isTrue();
        }

        @Test
        @DisplayName("an invocation without payloads passes")
        void noPayloads() {
            assertThat(pipeline.validate(List.of(), RuleContext.empty()).valid()).isTrue();
        }

        @Test
        @DisplayName("null arguments are skipped")
        void nullArgumentsSkipped() {
            var outcome = pipeline.validate(Arrays.asList(null, new Note("x")), RuleContext.empty());

            assertThat(outcome.valid()).isTrue();
        }

        @Test
        @DisplayName("errors of several payloads merge in payload order")
        void mergesInPayloadOrder() {
            var outcome = pipeline.validate(
                    List.of(new Note(""), new Paging(0, 0)),
                    RuleContext.of(Map.of(), executor));

            assertThat(outcome.errors().keySet()).containsExactly("Text", "PageNumber", "PageSize");
            assertThat(outcome.errorCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("every violated rule is reported")
        void reportsAllViolations() {
            var outcome = pipeline.validate(List.of(new Paging(0, 0)), RuleContext.empty());

            assertThat(outcome.errors()).containsExactly(
                    Map.entry("PageNumber", List.of("Page number must be set to a positive non-zero integer.")),
                    Map.entry("PageSize", List.of("You must return at least one record.")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a faulting rule raises RuleEvaluationException instead of a field error")
        void faultingRule() {
            var faulty = new ValidationPipeline(new ValidatorRegistry(List.of(new FaultyNoteValidator())));

            assertThatThrownBy(() -> faulty.validate(List.of(new Note("x")), RuleContext.of(Map.of(), executor)))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasRootCauseMessage("lookup failed");
        }

        @Test
        @DisplayName("exceeding the deadline raises RuleEvaluationException and cancels the context")
        void timeout() {
            var hanging = new ValidationPipeline(
                    new ValidatorRegistry(List.of(new HangingNoteValidator())), Duration.ofMillis(100));
            var context = RuleContext.of(Map.of(), executor);

            assertThatThrownBy(() -> hanging.validate(List.of(new Note("x")), context))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageContaining("100 ms");
            assertThat(context.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("interrupting the caller raises CancellationException and keeps the interrupt flag")
        void interrupted() {
            var hanging = new ValidationPipeline(new ValidatorRegistry(List.of(new HangingNoteValidator())));
            var context = RuleContext.of(Map.of(), executor);
            Thread.currentThread().interrupt();
            try {
                assertThatThrownBy(() -> hanging.validate(List.of(new Note("x")), context))
                        .isInstanceOf(CancellationException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
                assertThat(context.isCancelled()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("rejects a non-positive timeout")
        void rejectsZeroTimeout() {
            assertThatThrownBy(() -> new ValidationPipeline(new ValidatorRegistry(List.of()), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    static class FaultyNoteValidator extends AbstractValidator<Note> {
        FaultyNoteValidator() {
            super(Note.class);
            ruleFor("Text", Note::text).mustAsync((value, payload, context) -> context.supplyAsync(() -> {
                throw new IllegalStateException("lookup failed");
            }), "Text is invalid.");
        }
    }

    static class HangingNoteValidator extends AbstractValidator<Note> {
        HangingNoteValidator() {
            super(Note.class);
            ruleFor("Text", Note::text)
                    .mustAsync((value, payload, context) -> new CompletableFuture<>(), "Text is invalid.");
        }
    }
}
