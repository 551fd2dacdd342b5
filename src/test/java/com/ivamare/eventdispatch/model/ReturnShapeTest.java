package com.ivamare.eventdispatch.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ReturnShapeTest {

    @SuppressWarnings("unused")
    interface Shapes {
        void primitiveVoid();

        Void boxedVoid();

        Acknowledgement ack();

        Outcome outcome();

        ValueOutcome<List<String>> valueOutcome();

        Result result();

        CompletableFuture<Void> futureVoid();

        CompletionStage<Acknowledgement> stageAck();

        CompletionStage<? extends Result> stageWildcardResult();

        CompletableFuture<ValueOutcome<String>> futureValueOutcome();

        Future<Outcome> plainFuture();

        Optional<Outcome> optionalOutcome();

        Object object();
    }

    private static Optional<ReturnShape> shapeOf(String methodName) throws NoSuchMethodException {
        return ReturnShape.of(Shapes.class.getMethod(methodName));
    }

    @Test
    void shouldClassifySynchronousShapes() throws Exception {
        assertEquals(Optional.of(ReturnShape.NONE), shapeOf("primitiveVoid"));
        assertEquals(Optional.of(ReturnShape.NONE), shapeOf("boxedVoid"));
        assertEquals(Optional.of(ReturnShape.ACKNOWLEDGEMENT), shapeOf("ack"));
        assertEquals(Optional.of(ReturnShape.RESULT), shapeOf("outcome"));
        assertEquals(Optional.of(ReturnShape.RESULT), shapeOf("valueOutcome"));
        assertEquals(Optional.of(ReturnShape.RESULT), shapeOf("result"));
    }

    @Test
    void shouldClassifyAsynchronousShapes() throws Exception {
        assertEquals(Optional.of(ReturnShape.ASYNC_NONE), shapeOf("futureVoid"));
        assertEquals(Optional.of(ReturnShape.ASYNC_ACKNOWLEDGEMENT), shapeOf("stageAck"));
        assertEquals(Optional.of(ReturnShape.ASYNC_RESULT), shapeOf("stageWildcardResult"));
        assertEquals(Optional.of(ReturnShape.ASYNC_RESULT), shapeOf("futureValueOutcome"));
        assertTrue(ReturnShape.ASYNC_RESULT.isAsync());
        assertFalse(ReturnShape.RESULT.isAsync());
    }

    @Test
    void shouldRejectOtherShapes() throws Exception {
        assertTrue(shapeOf("plainFuture").isEmpty());
        assertTrue(shapeOf("optionalOutcome").isEmpty());
        assertTrue(shapeOf("object").isEmpty());
    }
}
