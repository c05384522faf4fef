package org.jackc.compiler.frontend.parser.ast;

/**
 * A single operand of an expression.
 */
public sealed interface TermNode extends AstNode permits
        TermNode.IntegerConstant, TermNode.StringConstant, TermNode.KeywordConstantTerm,
        TermNode.VarName, TermNode.ArrayElement, TermNode.Parenthesized, TermNode.UnaryOpTerm,
        SubroutineCallNode {

    /**
     * A decimal integer literal.
     * @param value The value, 0..32767.
     */
    record IntegerConstant(int value) implements TermNode {}

    /**
     * A string literal.
     * @param value The characters between the quotes.
     */
    record StringConstant(String value) implements TermNode {}

    /**
     * {@code true}, {@code false}, {@code null} or {@code this}.
     * @param constant The keyword constant.
     */
    record KeywordConstantTerm(KeywordConstant constant) implements TermNode {}

    /**
     * A bare variable reference.
     * @param name The variable name.
     */
    record VarName(IdentifierNode name) implements TermNode {}

    /**
     * {@code name[index]}
     * @param name The array variable.
     * @param index The element index.
     */
    record ArrayElement(IdentifierNode name, ExpressionNode index) implements TermNode {}

    /**
     * {@code (expression)}
     * @param expression The inner expression.
     */
    record Parenthesized(ExpressionNode expression) implements TermNode {}

    /**
     * {@code -term} or {@code ~term}
     * @param op The prefix operator.
     * @param term The operand.
     */
    record UnaryOpTerm(UnaryOp op, TermNode term) implements TermNode {}
}
