package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

public record AssignExpr(
        Identifier target,
        Expr value
) implements Expr {

    @Override
    public int precedence() {
        return Precedence.ASSIGN;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
