package com.ivamare.eventdispatch.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Nested
    class OutcomeTests {

        @Test
        void shouldCreateSuccess() {
            Outcome outcome = Outcome.success();

            assertTrue(outcome.isSuccess());
            assertTrue(outcome.error().isEmpty());
            assertSame(outcome, outcome.toOutcome());
        }

        @Test
        void shouldCreateFailureWithDefaultCode() {
            Outcome outcome = Outcome.failure("bad");

            assertFalse(outcome.isSuccess());
            assertEquals(HandlerError.FAILURE, outcome.error().orElseThrow().code());
            assertEquals("bad", outcome.error().orElseThrow().message());
        }

        @Test
        void shouldCompareByError() {
            assertEquals(Outcome.failure("bad"), Outcome.failure("bad"));
            assertNotEquals(Outcome.failure("bad"), Outcome.failure("worse"));
            assertNotEquals(Outcome.success(), Outcome.failure("bad"));
        }

        @Test
        void shouldRejectNullError() {
            assertThrows(NullPointerException.class, () -> Outcome.failure((HandlerError) null));
        }
    }

    @Nested
    class ValueOutcomeTests {

        @Test
        void shouldDiscardValueWhenReduced() {
            ValueOutcome<String> result = ValueOutcome.success("value");

            assertEquals("value", result.value().orElseThrow());
            assertEquals(Outcome.success(), result.toOutcome());
        }

        @Test
        void shouldKeepErrorWhenReduced() {
            HandlerError error = HandlerError.of("NOT_FOUND", "missing");
            ValueOutcome<Integer> result = ValueOutcome.failure(error);

            assertTrue(result.value().isEmpty());
            assertEquals(Outcome.failure(error), result.toOutcome());
        }
    }

    @Nested
    class HandlerErrorTests {

        @Test
        void shouldCopyDetails() {
            HandlerError error = HandlerError.of("LIMIT", "too many", Map.of("max", 5));

            assertEquals(Map.of("max", 5), error.details());
            assertFalse(error.isFault());
            assertEquals("[LIMIT] too many", error.toString());
        }

        @Test
        void shouldDefaultDetailsToEmpty() {
            HandlerError error = new HandlerError("CODE", "message", null, null);

            assertEquals(Map.of(), error.details());
        }

        @Test
        void shouldDescribeFault() {
            IllegalStateException fault = new IllegalStateException("boom");

            HandlerError error = HandlerError.fault(fault);

            assertEquals(HandlerError.FAULT, error.code());
            assertEquals("java.lang.IllegalStateException: boom", error.message());
            assertSame(fault, error.cause());
            assertTrue(error.isFault());
        }

        @Test
        void shouldUnwrapCompletionException() {
            IllegalArgumentException fault = new IllegalArgumentException("inner");

            HandlerError error = HandlerError.fault(new CompletionException(fault));

            assertSame(fault, error.cause());
            assertEquals("java.lang.IllegalArgumentException: inner", error.message());
        }
    }

    @Nested
    class AggregateOutcomeTests {

        @Test
        void shouldBeSuccessfulWhenNoFailures() {
            AggregateOutcome outcome = AggregateOutcome.of(List.of());

            assertTrue(outcome.success());
            assertSame(AggregateOutcome.empty(), outcome);
        }

        @Test
        void shouldKeepFailureOrder() {
            AggregateOutcome outcome = AggregateOutcome.of(List.of(HandlerError.of("first"), HandlerError.of("second")));

            assertFalse(outcome.success());
            assertEquals(List.of("first", "second"), outcome.failureMessages());
        }

        @Test
        void shouldRejectInconsistentSuccessFlag() {
            assertThrows(IllegalArgumentException.class, () ->
                new AggregateOutcome(true, List.of(HandlerError.of("bad"))));
            assertThrows(IllegalArgumentException.class, () ->
                new AggregateOutcome(false, List.of()));
        }

        @Test
        void shouldExposeImmutableFailures() {
            AggregateOutcome outcome = AggregateOutcome.of(List.of(HandlerError.of("bad")));

            assertThrows(UnsupportedOperationException.class, () -> outcome.failures().clear());
        }
    }
}
