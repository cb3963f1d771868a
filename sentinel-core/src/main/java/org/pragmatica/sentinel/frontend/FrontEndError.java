package org.pragmatica.sentinel.frontend;

import org.pragmatica.sentinel.shared.SentinelError;

/**
 * Errors raised while turning source text into operation trees.
 */
public sealed interface FrontEndError extends SentinelError {

    record ParseError(String file, int line, int column, String details) implements FrontEndError {
        @Override
        public String message() {
            return file + ":" + line + ":" + column + ": parse error: " + details;
        }
    }

    record ReadFailed(String file, String reason) implements FrontEndError {
        @Override
        public String message() {
            return "Cannot read " + file + ": " + reason;
        }
    }

    static FrontEndError parseError(String file, int line, int column, String details) {
        return new ParseError(file, line, column, details);
    }
}
