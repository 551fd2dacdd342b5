package com.ivamare.eventdispatch.exception;

/**
 * Base exception for all Event Dispatch errors.
 */
public class EventDispatchException extends RuntimeException {

    public EventDispatchException(String message) {
        super(message);
    }

    public EventDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
