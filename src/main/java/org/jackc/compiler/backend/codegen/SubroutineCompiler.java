package org.jackc.compiler.backend.codegen;

import org.jackc.compiler.api.CompilationException;
import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.backend.vm.ArithmeticCommand;
import org.jackc.compiler.backend.vm.Segment;
import org.jackc.compiler.backend.vm.VmWriter;
import org.jackc.compiler.diagnostics.CompilerLogger;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.parser.ast.BinaryOp;
import org.jackc.compiler.frontend.parser.ast.ExpressionNode;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.KeywordConstant;
import org.jackc.compiler.frontend.parser.ast.ParameterNode;
import org.jackc.compiler.frontend.parser.ast.StatementNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineCallNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineDecNode;
import org.jackc.compiler.frontend.parser.ast.TermNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;
import org.jackc.compiler.frontend.parser.ast.UnaryOp;
import org.jackc.compiler.frontend.parser.ast.VarDecNode;
import org.jackc.compiler.frontend.semantics.ClassSymbolTable;
import org.jackc.compiler.frontend.semantics.SubroutineSymbolTable;
import org.jackc.compiler.frontend.semantics.SymbolEntry;
import org.jackc.compiler.frontend.semantics.SymbolKind;
import org.jackc.compiler.frontend.semantics.SymbolTable;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Generates the VM code of one subroutine. A new instance, with a fresh
 * subroutine symbol table, is created for every subroutine of a class.
 */
class SubroutineCompiler {

    /** The lookup order of variable resolution. Fields are found before locals of the same name. */
    private static final List<SymbolKind> RESOLUTION_ORDER =
            List.of(SymbolKind.FIELD, SymbolKind.VAR, SymbolKind.ARGUMENT, SymbolKind.STATIC);

    private final ClassCompiler classCompiler;
    private final SubroutineDecNode subroutineDec;
    private final ClassSymbolTable classTable;
    private final SubroutineSymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final VmWriter writer;
    private final CompilerLogger log;

    SubroutineCompiler(ClassCompiler classCompiler, SubroutineDecNode subroutineDec) {
        this.classCompiler = classCompiler;
        this.subroutineDec = subroutineDec;
        this.classTable = classCompiler.symbolTable();
        this.diagnostics = classCompiler.diagnostics();
        this.symbolTable = new SubroutineSymbolTable(diagnostics);
        this.writer = classCompiler.writer();
        this.log = classCompiler.log().forPhase(SubroutineCompiler.class);
    }

    void compile() throws CompilationException {
        String name = classCompiler.className() + "." + subroutineDec.name().name();
        writer.writeFunction(name, subroutineDec.body().localCount());

        switch (subroutineDec.kind()) {
            case CONSTRUCTOR -> {
                writer.writePush(Segment.CONSTANT, classTable.fieldCount());
                writer.writeCall("Memory.alloc", 1);
                writer.writePop(Segment.POINTER, 0);
            }
            case METHOD -> {
                symbolTable.reserveReceiver();
                writer.writePush(Segment.ARGUMENT, 0);
                writer.writePop(Segment.POINTER, 0);
            }
            case FUNCTION -> {
                // no receiver
            }
        }

        for (ParameterNode parameter : subroutineDec.parameters()) {
            warnIfShadowed(parameter.name());
            symbolTable.insertArgument(parameter.name(), parameter.type());
        }
        for (VarDecNode varDec : subroutineDec.body().varDecs()) {
            for (IdentifierNode varName : varDec.names()) {
                warnIfShadowed(varName);
                symbolTable.insertVar(varName, varDec.type());
            }
        }

        compileStatements(subroutineDec.body().statements());
    }

    private void warnIfShadowed(IdentifierNode name) {
        if (classTable.getField(name.name()).isPresent()) {
            diagnostics.reportWarning(CompilerErrorCode.SHADOWED_BY_FIELD,
                    "'" + name.name() + "' in " + classCompiler.className() + "." + subroutineDec.name().name()
                            + " has the name of a field; references to it resolve to the field.",
                    name.token().fileName(), name.line());
        }
    }

    // --- Statements ---

    private void compileStatements(List<StatementNode> statements) throws CompilationException {
        for (StatementNode statement : statements) {
            compileStatement(statement);
        }
    }

    private void compileStatement(StatementNode statement) throws CompilationException {
        if (statement instanceof StatementNode.Let let) {
            compileLet(let);
        } else if (statement instanceof StatementNode.If ifStatement) {
            compileIf(ifStatement);
        } else if (statement instanceof StatementNode.While whileStatement) {
            compileWhile(whileStatement);
        } else if (statement instanceof StatementNode.Do doStatement) {
            compileSubroutineCall(doStatement.call());
            writer.writePop(Segment.TEMP, 0);
        } else if (statement instanceof StatementNode.Return returnStatement) {
            if (returnStatement.value().isPresent()) {
                compileExpression(returnStatement.value().get());
            } else {
                writer.writePush(Segment.CONSTANT, 0);
            }
            writer.writeReturn();
        } else {
            throw new IllegalStateException("Unhandled statement: " + statement.getClass().getSimpleName());
        }
    }

    private void compileLet(StatementNode.Let let) throws CompilationException {
        SymbolEntry target = require(let.target());
        Segment segment = Segment.of(target.kind());

        if (let.index().isPresent()) {
            compileExpression(let.index().get());
            writer.writePush(segment, target.index());
            writer.writeArithmetic(ArithmeticCommand.ADD);

            compileExpression(let.value());
            writer.writePop(Segment.TEMP, 0);

            writer.writePop(Segment.POINTER, 1);
            writer.writePush(Segment.TEMP, 0);
            writer.writePop(Segment.THAT, 0);
        } else {
            compileExpression(let.value());
            writer.writePop(segment, target.index());
        }
    }

    private void compileIf(StatementNode.If ifStatement) throws CompilationException {
        compileExpression(ifStatement.condition());
        writer.writeArithmetic(ArithmeticCommand.NOT);

        String endLabel = classCompiler.nextLabel();
        String elseLabel = classCompiler.nextLabel();

        writer.writeIf(elseLabel);
        compileStatements(ifStatement.thenBranch());
        writer.writeGoto(endLabel);
        writer.writeLabel(elseLabel);
        if (ifStatement.elseBranch().isPresent()) {
            compileStatements(ifStatement.elseBranch().get());
        }
        writer.writeLabel(endLabel);
    }

    private void compileWhile(StatementNode.While whileStatement) throws CompilationException {
        String loopLabel = classCompiler.nextLabel();
        String exitLabel = classCompiler.nextLabel();

        writer.writeLabel(loopLabel);
        compileExpression(whileStatement.condition());
        writer.writeArithmetic(ArithmeticCommand.NOT);
        writer.writeIf(exitLabel);
        compileStatements(whileStatement.body());
        writer.writeGoto(loopLabel);
        writer.writeLabel(exitLabel);
    }

    // --- Expressions ---

    private void compileExpression(ExpressionNode expression) throws CompilationException {
        compileTerm(expression.head());
        for (ExpressionNode.OpTerm opTerm : expression.tail()) {
            compileTerm(opTerm.term());
            compileBinaryOp(opTerm.op());
        }
    }

    private void compileTerm(TermNode term) throws CompilationException {
        if (term instanceof TermNode.IntegerConstant constant) {
            writer.writePush(Segment.CONSTANT, constant.value());
        } else if (term instanceof TermNode.StringConstant string) {
            compileString(string.value());
        } else if (term instanceof TermNode.KeywordConstantTerm keyword) {
            compileKeywordConstant(keyword.constant());
        } else if (term instanceof TermNode.VarName varName) {
            SymbolEntry entry = require(varName.name());
            writer.writePush(Segment.of(entry.kind()), entry.index());
        } else if (term instanceof TermNode.ArrayElement element) {
            SymbolEntry entry = require(element.name());
            compileExpression(element.index());
            writer.writePush(Segment.of(entry.kind()), entry.index());
            writer.writeArithmetic(ArithmeticCommand.ADD);
            writer.writePop(Segment.POINTER, 1);
            writer.writePush(Segment.THAT, 0);
        } else if (term instanceof TermNode.Parenthesized parenthesized) {
            compileExpression(parenthesized.expression());
        } else if (term instanceof TermNode.UnaryOpTerm unary) {
            compileTerm(unary.term());
            writer.writeArithmetic(unary.op() == UnaryOp.NEGATE ? ArithmeticCommand.NEG : ArithmeticCommand.NOT);
        } else if (term instanceof SubroutineCallNode call) {
            compileSubroutineCall(call);
        } else {
            throw new IllegalStateException("Unhandled term: " + term.getClass().getSimpleName());
        }
    }

    private void compileString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writer.writePush(Segment.CONSTANT, bytes.length);
        writer.writeCall("String.new", 1);
        for (byte b : bytes) {
            writer.writePush(Segment.CONSTANT, b & 0xFF);
            writer.writeCall("String.appendChar", 2);
        }
    }

    private void compileKeywordConstant(KeywordConstant constant) {
        switch (constant) {
            case TRUE -> {
                writer.writePush(Segment.CONSTANT, 1);
                writer.writeArithmetic(ArithmeticCommand.NEG);
            }
            case FALSE, NULL -> writer.writePush(Segment.CONSTANT, 0);
            case THIS -> writer.writePush(Segment.POINTER, 0);
        }
    }

    private void compileBinaryOp(BinaryOp op) {
        switch (op) {
            case PLUS -> writer.writeArithmetic(ArithmeticCommand.ADD);
            case MINUS -> writer.writeArithmetic(ArithmeticCommand.SUB);
            case MULTIPLY -> writer.writeCall("Math.multiply", 2);
            case DIVIDE -> writer.writeCall("Math.divide", 2);
            case AND -> writer.writeArithmetic(ArithmeticCommand.AND);
            case OR -> writer.writeArithmetic(ArithmeticCommand.OR);
            case LESS_THAN -> writer.writeArithmetic(ArithmeticCommand.LT);
            case GREATER_THAN -> writer.writeArithmetic(ArithmeticCommand.GT);
            case EQUAL -> writer.writeArithmetic(ArithmeticCommand.EQ);
        }
    }

    private void compileSubroutineCall(SubroutineCallNode call) throws CompilationException {
        int argumentCount = call.arguments().size();
        String target;

        if (call instanceof SubroutineCallNode.ClassCall classCall) {
            Optional<SymbolEntry> receiver = resolve(classCall.target());
            if (receiver.isPresent()) {
                SymbolEntry entry = receiver.get();
                Optional<String> receiverClass = entry.type().className();
                if (receiverClass.isEmpty()) {
                    throw error(CompilerErrorCode.MALFORMED_CONSTRUCT, classCall.target(),
                            "Cannot call '" + classCall.subroutineName().name() + "' on '" + entry.name()
                                    + "': its type " + describe(entry.type()) + " is not a class.");
                }
                writer.writePush(Segment.of(entry.kind()), entry.index());
                target = receiverClass.get();
                argumentCount++;
            } else {
                target = classCall.target().name();
            }
        } else {
            writer.writePush(Segment.POINTER, 0);
            target = classCompiler.className();
            argumentCount++;
        }

        for (ExpressionNode argument : call.arguments()) {
            compileExpression(argument);
        }
        writer.writeCall(target + "." + call.subroutineName().name(), argumentCount);
    }

    // --- Variable resolution ---

    /**
     * Looks a name up in fields, locals, arguments and statics, in that order.
     * @param name The variable reference.
     * @return The first matching entry, or empty if the name is not a variable.
     */
    private Optional<SymbolEntry> resolve(IdentifierNode name) {
        for (SymbolKind kind : RESOLUTION_ORDER) {
            SymbolTable table = (kind == SymbolKind.FIELD || kind == SymbolKind.STATIC) ? classTable : symbolTable;
            Optional<SymbolEntry> entry = table.get(kind, name.name());
            if (entry.isPresent()) {
                log.debug("resolved '{}' to {} {} (line {})", name.name(), kind, entry.get().index(), name.line());
                return entry;
            }
        }
        log.debug("'{}' is not a variable (line {})", name.name(), name.line());
        return Optional.empty();
    }

    private SymbolEntry require(IdentifierNode name) throws CompilationException {
        Optional<SymbolEntry> entry = resolve(name);
        if (entry.isEmpty()) {
            throw error(CompilerErrorCode.UNRESOLVED_IDENTIFIER, name,
                    "Unknown variable '" + name.name() + "' in " + classCompiler.className() + "."
                            + subroutineDec.name().name() + ".");
        }
        return entry.get();
    }

    private CompilationException error(CompilerErrorCode code, IdentifierNode at, String message) {
        diagnostics.reportError(code, message, at.token().fileName(), at.line());
        return new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
    }

    private static String describe(TypeNode type) {
        if (type instanceof TypeNode.Primitive primitive) {
            return primitive.keyword().lexeme();
        }
        return type.className().orElse("?");
    }
}
