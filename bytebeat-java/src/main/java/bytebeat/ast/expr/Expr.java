package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;
import bytebeat.print.Printer;
import bytebeat.sema.TypeChecker;
import bytebeat.sema.TypeContext;
import bytebeat.sema.UbChecker;
import bytebeat.sema.UbInfo;
import bytebeat.simplify.Simplifier;
import bytebeat.types.TypeResult;

import java.util.Optional;

/**
 * An immutable expression node. Every operation returns fresh nodes, so a tree
 * can be shared between programs, threads and printings.
 */
public sealed interface Expr
        permits Value, UnaryExpr, BinaryExpr, AssignExpr,
        TernaryExpr, ExprList, FunctionCall {

    /** Binding strength; lower binds tighter. Atoms report {@link Precedence#ATOM}. */
    int precedence();

    default boolean isAtomic() {
        return precedence() == Precedence.ATOM;
    }

    /** Types this node against {@code ctx}, auto-declaring unknown identifiers into it. */
    default TypeResult type(TypeContext ctx) {
        return new TypeChecker(ctx).typeOf(this);
    }

    default Expr simplify() {
        return new Simplifier().simplify(this);
    }

    default Optional<UbInfo> checkUb() {
        return new UbChecker().check(this);
    }

    default String toString(PrintStyle style) {
        return Printer.print(this, style);
    }
}
