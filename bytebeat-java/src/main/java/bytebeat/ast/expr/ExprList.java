package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

import java.util.List;

/** Comma sequencing; a single expression is never wrapped in a list. */
public record ExprList(List<Expr> exprs) implements Expr {

    public ExprList {
        exprs = List.copyOf(exprs);
        if (exprs.size() < 2) {
            throw new IllegalArgumentException("ExprList needs at least two expressions, got " + exprs.size());
        }
    }

    public Expr last() {
        return exprs.get(exprs.size() - 1);
    }

    @Override
    public int precedence() {
        return Precedence.LIST;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
