package org.pragmatica.sharplint.error;

import org.pragmatica.sharplint.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected token.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Malformed token, such as an unterminated string or an unknown character.
     */
    record LexicalError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
