package com.workforce.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AbstractValidator}: rule accumulation per field, deterministic field order
 * under concurrent evaluation, and the distinction between invalid values and rules that fail to
 * evaluate.
 */
@DisplayName("AbstractValidator")
class AbstractValidatorTest {

    record Contact(String email, String name, String website) {}

    record Triple(String a, String b, String c) {}

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    static class ContactValidator extends AbstractValidator<Contact> {
        ContactValidator() {
            super(Contact.class);
            ruleFor("Email", Contact::email)
                    .must(Rules.notEmpty(), "Email is required.")
                    .must(Rules.emailAddress(), "A valid email is required.");
            ruleFor("Name", Contact::name)
                    .must(Rules.maxLength(10), "Name cannot exceed 10 characters.");
            ruleFor("Website", Contact::website)
                    .must(Rules.maxLength(30), "Website cannot exceed 30 characters.")
                    .must(Rules.absoluteUri(), "Website must be a valid URL.");
        }
    }

    @Nested
    @DisplayName("Synchronous rules")
    class SynchronousRules {

        private final ContactValidator validator = new ContactValidator();

        @Test
        @DisplayName("a valid payload yields a valid outcome")
        void validPayload() {
            var outcome = validator.validate(
                    new Contact("ann@example.com", "Ann", "https://ann.example.com"), RuleContext.empty()).join();

            assertThat(outcome.valid()).isTrue();
            assertThat(outcome.errors()).isEmpty();
        }

        @Test
        @DisplayName("every failing rule of a field contributes its message")
        void accumulatesAllMessagesForField() {
            var outcome = validator.validate(
                    new Contact("", "Ann", "pages/about-ann-and-her-family.html"), RuleContext.empty()).join();

            assertThat(outcome.errors().get("Email"))
                    .containsExactly("Email is required.", "A valid email is required.");
            assertThat(outcome.errors().get("Website")).containsExactly(
                    "Website cannot exceed 30 characters.",
                    "Website must be a valid URL.");
        }

        @Test
        @DisplayName("fields are reported in declaration order")
        void declarationOrder() {
            var outcome = validator.validate(
                    new Contact(null, "Annabel Lee Smith", "not a url"), RuleContext.empty()).join();

            assertThat(outcome.errors().keySet()).containsExactly("Email", "Name", "Website");
        }

        @Test
        @DisplayName("optional fields left out collect no messages")
        void optionalFieldsOmitted() {
            var outcome = validator.validate(new Contact("ann@example.com", null, null), RuleContext.empty()).join();

            assertThat(outcome.valid()).isTrue();
        }

        @Test
        @DisplayName("the payload type is exposed for registration")
        void payloadType() {
            assertThat(validator.payloadType()).isEqualTo(Contact.class);
        }
    }

    @Nested
    @DisplayName("Asynchronous rules")
    class AsynchronousRules {

        @Test
        @DisplayName("error map keeps declaration order when the middle field resolves last")
        void slowMiddleFieldKeepsOrder() {
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).mustAsync(delayed(10), "A is wrong.");
                    ruleFor("B", Triple::b).mustAsync(delayed(300), "B is wrong.");
                    ruleFor("C", Triple::c).mustAsync(delayed(0), "C is wrong.");
                }
            };
            var context = RuleContext.of(Map.of(), executor);

            var outcome = validator.validate(new Triple("a", "b", "c"), context).join();

            assertThat(outcome.errors().keySet()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("fields are evaluated concurrently")
        void fieldsRunConcurrently() {
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).mustAsync(delayed(200), "A is wrong.");
                    ruleFor("B", Triple::b).mustAsync(delayed(200), "B is wrong.");
                    ruleFor("C", Triple::c).mustAsync(delayed(200), "C is wrong.");
                }
            };
            var context = RuleContext.of(Map.of(), executor);

            long start = System.nanoTime();
            validator.validate(new Triple("a", "b", "c"), context).join();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMs).isLessThan(550);
        }

        @Test
        @DisplayName("rules of one field run in declaration order")
        void rulesOfOneFieldRunSequentially() {
            var sequence = new java.util.concurrent.CopyOnWriteArrayList<String>();
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a)
                            .mustAsync((v, p, ctx) -> ctx.supplyAsync(() -> {
                                sleep(100);
                                sequence.add("first");
                                return false;
                            }), "first failed")
                            .must(v -> sequence.add("second") && false, "second failed");
                }
            };

            var outcome = validator.validate(
                    new Triple("a", null, null), RuleContext.of(Map.of(), executor)).join();

            assertThat(sequence).containsExactly("first", "second");
            assertThat(outcome.errors().get("A")).containsExactly("first failed", "second failed");
        }

        @Test
        @DisplayName("a rule that throws surfaces as RuleEvaluationException, not a field error")
        void faultingRule() {
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).mustAsync((v, p, ctx) -> ctx.supplyAsync(() -> {
                        throw new IllegalStateException("database unreachable");
                    }), "A is wrong.");
                }
            };

            assertThatThrownBy(() -> validator.validate(
                    new Triple("a", null, null), RuleContext.of(Map.of(), executor)).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(RuleEvaluationException.class)
                    .hasRootCauseMessage("database unreachable");
        }

        @Test
        @DisplayName("a synchronous exception inside a predicate is reported with its field")
        void throwingPredicate() {
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("B", Triple::b).must(v -> v.length() > 2, "B is too short.");
                }
            };

            var future = validator.validate(new Triple(null, null, null), RuleContext.empty());

            assertThatThrownBy(future::join)
                    .hasCauseInstanceOf(RuleEvaluationException.class)
                    .satisfies(e -> assertThat(((RuleEvaluationException) e.getCause()).field()).isEqualTo("B"));
        }

        @Test
        @DisplayName("rules are skipped once the context is cancelled")
        void cancelledContext() {
            var calls = new AtomicInteger();
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).must(v -> calls.incrementAndGet() > 0, "never");
                }
            };
            var context = RuleContext.empty();
            context.cancel();

            assertThatThrownBy(() -> validator.validate(new Triple("a", null, null), context).join())
                    .satisfies(e -> assertThat(e instanceof CancellationException
                            || e.getCause() instanceof CancellationException).isTrue());
            assertThat(calls).hasValue(0);
        }
    }

    @Nested
    @DisplayName("Declaration")
    class Declaration {

        @Test
        @DisplayName("declaring the same field twice appends to one chain")
        void sameFieldTwice() {
            var validator = new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).must(Rules.notEmpty(), "A is required.");
                    ruleFor("B", Triple::b).must(Rules.notEmpty(), "B is required.");
                    ruleFor("A", Triple::a).must(Rules.maxLength(1), "A is too long.");
                }
            };

            var outcome = validator.validate(new Triple("", "", null), RuleContext.empty()).join();

            assertThat(outcome.errors().keySet()).containsExactly("A", "B");
            assertThat(outcome.errors().get("A")).containsExactly("A is required.");
        }

        @Test
        @DisplayName("rejects a blank message")
        void rejectsBlankMessage() {
            assertThatThrownBy(() -> new AbstractValidator<Triple>(Triple.class) {
                {
                    ruleFor("A", Triple::a).must(Rules.notEmpty(), " ");
                }
            }).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a validator without rules accepts everything")
        void noRules() {
            var validator = new AbstractValidator<Triple>(Triple.class) { };

            assertThat(validator.validate(new Triple(null, null, null), RuleContext.empty()).join().valid())
                    .isTrue();
        }
    }

    private static FieldRule<Triple, String> delayed(long millis) {
        return (value, payload, context) -> context.supplyAsync(() -> {
            sleep(millis);
            return false;
        });
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
