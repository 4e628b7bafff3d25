package com.tidewatch.heartbeat.check;

import java.time.Duration;
import java.util.Map;

/**
 * Helpers shared by check implementations.
 */
public final class Checks {

    private Checks() {
    }

    /** What a check body reports; the name and duration are filled in by {@link #timed}. */
    public record Outcome(boolean ok, String message, Map<String, Object> data) {

        public static Outcome ok(String message, Map<String, Object> data) {
            return new Outcome(true, message, data);
        }

        public static Outcome failed(String message, Map<String, Object> data) {
            return new Outcome(false, message, data);
        }
    }

    @FunctionalInterface
    public interface Body {
        Outcome run() throws Exception;
    }

    /**
     * Run {@code body}, measuring how long it took. An exception becomes a
     * failed result with message {@code "Exception: <message>"}.
     */
    public static CheckResult timed(String name, Body body) {
        long start = System.nanoTime();
        try {
            Outcome outcome = body.run();
            return new CheckResult(name, outcome.ok(), outcome.message(), since(start), outcome.data());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckResult.failed(name, "Exception: interrupted", since(start));
        } catch (Exception e) {
            return CheckResult.failed(name, "Exception: " + e.getMessage(), since(start));
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
