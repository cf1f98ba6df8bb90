package org.pragmatica.sharplint.format;

import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxToken;

import java.util.Optional;

/**
 * Replacement computed for one block.
 *
 * @param originalBlock      Block instance captured from the tree
 * @param newBlock           Reformatted block
 * @param precedingToken     Token before the open brace, captured from the tree
 * @param newPrecedingToken  Replacement for the preceding token, empty when it stays as is
 */
public record FormattedBlock(
    SyntaxNode originalBlock,
    SyntaxNode newBlock,
    SyntaxToken precedingToken,
    Optional<SyntaxToken> newPrecedingToken) {}
