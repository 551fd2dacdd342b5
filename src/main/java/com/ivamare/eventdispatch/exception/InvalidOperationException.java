package com.ivamare.eventdispatch.exception;

/**
 * Thrown when an operation is attempted in the wrong lifecycle phase,
 * e.g. dispatching before the dispatch table has been built.
 */
public class InvalidOperationException extends EventDispatchException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
