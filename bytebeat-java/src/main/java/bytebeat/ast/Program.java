package bytebeat.ast;

import bytebeat.ast.expr.Expr;
import bytebeat.ast.expr.FunctionCall;
import bytebeat.lexer.Lexer;
import bytebeat.parser.Parser;
import bytebeat.print.PrintStyle;
import bytebeat.print.Printer;
import bytebeat.sema.TypeChecker;
import bytebeat.sema.TypeContext;
import bytebeat.sema.TypeError;
import bytebeat.sema.UbChecker;
import bytebeat.sema.UbInfo;
import bytebeat.simplify.Simplifier;
import bytebeat.types.PrimitiveType;
import bytebeat.types.TypeResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statements followed by the output expression. Type checking and undefined
 * behavior detection run once, in the constructor. A well-typed output that is
 * not an int is wrapped in an {@code int(...)} cast.
 */
public final class Program {
    private final List<Statement> statements;
    private final Expr expr;
    private final TypeContext typeContext = new TypeContext();
    private final List<TypeError> typeErrors;
    private final TypeResult exprType;
    private final UbInfo ubInfo;

    public Program(List<Statement> statements, Expr expr) {
        this.statements = List.copyOf(statements);

        TypeChecker checker = new TypeChecker(typeContext);
        List<TypeError> errors = new ArrayList<>();
        for (Statement s : this.statements) {
            errors.addAll(checker.checkStatement(s).errors());
        }
        TypeResult type = checker.typeOf(expr);
        errors.addAll(type.errors());
        this.typeErrors = List.copyOf(errors);

        if (!type.isErr() && !type.is(PrimitiveType.INT)) {
            this.expr = FunctionCall.cast(PrimitiveType.INT, expr);
            this.exprType = TypeResult.ok(PrimitiveType.INT);
        } else {
            this.expr = expr;
            this.exprType = type;
        }

        this.ubInfo = findUb();
    }

    public static Program parse(String source) {
        var tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private UbInfo findUb() {
        UbChecker ub = new UbChecker();
        for (Statement s : statements) {
            Optional<UbInfo> found = ub.check(s.expr());
            if (found.isPresent()) return found.get();
        }
        return ub.check(expr).orElse(null);
    }

    public Program simplify() {
        Simplifier simplifier = new Simplifier(typeContext);
        List<Statement> simplified = new ArrayList<>();
        for (Statement s : statements) {
            simplified.add(simplifier.simplify(s));
        }
        return new Program(simplified, simplifier.simplify(expr));
    }

    public List<Statement> statements() {
        return statements;
    }

    public Expr expr() {
        return expr;
    }

    public TypeContext typeContext() {
        return typeContext;
    }

    public List<TypeError> typeErrors() {
        return typeErrors;
    }

    /** Type of the output expression, int once coerced; an error result when it does not type check. */
    public TypeResult exprType() {
        return exprType;
    }

    /** The first undefined behavior found, statements first. */
    public Optional<UbInfo> ubInfo() {
        return Optional.ofNullable(ubInfo);
    }

    public String toString(PrintStyle style) {
        return Printer.print(this, style);
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
