package com.ivamare.eventdispatch.support;

/**
 * Event and dependency types shared by the tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public record MessageCreated(String channel, String content) {
    }

    public record MessageDeleted(String messageId) {
    }

    public interface Greeter {
        String greet(String name);
    }

    public static class EnglishGreeter implements Greeter {
        @Override
        public String greet(String name) {
            return "Hello, " + name;
        }
    }

    public interface AuditLog {
        void record(String entry);
    }
}
