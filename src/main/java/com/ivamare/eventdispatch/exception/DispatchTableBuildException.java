package com.ivamare.eventdispatch.exception;

/**
 * Thrown when the dispatch table cannot be built. No partial table is ever produced.
 *
 * <p>This is a startup failure: the application must not begin accepting events.
 */
public class DispatchTableBuildException extends EventDispatchException {

    public DispatchTableBuildException(HandlerCompilationException cause) {
        super("Failed to build dispatch table: " + cause.getMessage(), cause);
    }

    @Override
    public synchronized HandlerCompilationException getCause() {
        return (HandlerCompilationException) super.getCause();
    }
}
