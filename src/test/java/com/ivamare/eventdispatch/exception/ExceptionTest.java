package com.ivamare.eventdispatch.exception;

import com.ivamare.eventdispatch.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.support.RecordingHandlers;
import com.ivamare.eventdispatch.support.TestEvents.Greeter;
import com.ivamare.eventdispatch.support.TestEvents.MessageCreated;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Nested
    class EventDispatchExceptionTest {

        @Test
        void shouldCreateWithMessage() {
            EventDispatchException exception = new EventDispatchException("Test message");
            assertEquals("Test message", exception.getMessage());
            assertNull(exception.getCause());
        }

        @Test
        void shouldCreateWithMessageAndCause() {
            RuntimeException cause = new RuntimeException("Original error");
            EventDispatchException exception = new EventDispatchException("Test message", cause);
            assertEquals(cause, exception.getCause());
        }

        @Test
        void shouldBeRuntimeException() {
            assertInstanceOf(RuntimeException.class, new InvalidOperationException("Test"));
        }
    }

    @Nested
    class HandlerValidationExceptionTest {

        @Test
        void shouldDescribeMethodAndEventType() throws Exception {
            Method method = RecordingHandlers.class.getMethod("noValue", MessageCreated.class);

            HandlerValidationException exception =
                new HandlerValidationException(MessageCreated.class, method, "registry sealed");

            assertEquals("Cannot register handler RecordingHandlers.noValue() for MessageCreated: registry sealed",
                exception.getMessage());
            assertEquals(method, exception.getMethod());
            assertEquals(MessageCreated.class, exception.getEventType());
        }

        @Test
        void shouldDescribeWithoutMethod() {
            HandlerValidationException exception =
                new HandlerValidationException(MessageCreated.class, null, "no public method 'x'");

            assertEquals("Cannot register handler for MessageCreated: no public method 'x'", exception.getMessage());
        }
    }

    @Nested
    class BuildExceptionTest {

        @Test
        void shouldWrapCompilationException() {
            HandlerDescriptor descriptor = new DefaultHandlerRegistry(false)
                .register(MessageCreated.class, new RecordingHandlers(), "withDependency");
            HandlerCompilationException cause = new HandlerCompilationException(descriptor, Greeter.class);

            DispatchTableBuildException exception = new DispatchTableBuildException(cause);

            assertSame(cause, exception.getCause());
            assertTrue(exception.getMessage().startsWith("Failed to build dispatch table: No dependency of type"));
            assertTrue(exception.getMessage().endsWith("RecordingHandlers.withDependency(MessageCreated)"));
        }
    }
}
