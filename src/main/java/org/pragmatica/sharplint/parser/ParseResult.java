package org.pragmatica.sharplint.parser;

import org.pragmatica.sharplint.error.ParseError;
import org.pragmatica.sharplint.tree.SyntaxTree;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of parsing a source text - either a syntax tree or the first error met.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed tree. Throws {@link IllegalStateException} carrying the error message on failure.
     */
    SyntaxTree unwrap();

    default Optional<SyntaxTree> tree() {
        return this instanceof Success success
               ? Optional.of(success.syntaxTree())
               : Optional.empty();
    }

    default Optional<ParseError> error() {
        return this instanceof Failure failure
               ? Optional.of(failure.parseError())
               : Optional.empty();
    }

    default <T> T fold(Function<ParseError, T> onFailure, Function<SyntaxTree, T> onSuccess) {
        return this instanceof Success success
               ? onSuccess.apply(success.syntaxTree())
               : onFailure.apply(((Failure) this).parseError());
    }

    /**
     * Successful parse.
     */
    record Success(SyntaxTree syntaxTree) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public SyntaxTree unwrap() {
            return syntaxTree;
        }
    }

    /**
     * Failed parse with the first error found.
     */
    record Failure(ParseError parseError) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public SyntaxTree unwrap() {
            throw new IllegalStateException(parseError.message());
        }
    }
}
