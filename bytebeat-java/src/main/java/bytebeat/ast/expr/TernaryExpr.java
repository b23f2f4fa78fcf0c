package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

public record TernaryExpr(
        Expr condition,
        Expr whenTrue,
        Expr whenFalse
) implements Expr {

    @Override
    public int precedence() {
        return Precedence.TERNARY;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
