package org.pragmatica.sentinel.shared;

/**
 * Common supertype of every error value returned on the left side of an {@code Either}.
 * <p>
 * Errors are values, not exceptions: each failing operation returns one of the sealed
 * error families ({@code TraversalError}, {@code FixError}, {@code FrontEndError}) and the
 * caller decides whether to report, skip or abort.
 */
public interface SentinelError {

    /**
     * Human-readable description, ready for a console line.
     */
    String message();

    /**
     * Wrap an exception that escaped from code outside the engine's control.
     */
    static SentinelError unexpected(Throwable throwable) {
        return new Unexpected(throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }

    static SentinelError unexpected(String message) {
        return new Unexpected(message);
    }

    record Unexpected(String message) implements SentinelError {}
}
