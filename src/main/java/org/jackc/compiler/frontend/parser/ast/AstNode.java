package org.jackc.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable records; the tree is owned by the parser's caller and
 * only read by the code generator.
 */
public interface AstNode {
}
