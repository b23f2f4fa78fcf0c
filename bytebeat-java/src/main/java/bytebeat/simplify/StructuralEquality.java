package bytebeat.simplify;

import bytebeat.ast.expr.BinaryExpr;
import bytebeat.ast.expr.Expr;
import bytebeat.ast.expr.UnaryExpr;
import bytebeat.ast.expr.Value;

/**
 * Equality used to match a repeated wildcard. Operators compare by symbol;
 * anything other than values, unary and binary operations is never equal.
 */
public final class StructuralEquality {
    private StructuralEquality() {}

    public static boolean equal(Expr a, Expr b) {
        if (a instanceof Value x && b instanceof Value y) {
            return x.operand().equals(y.operand());
        }
        if (a instanceof UnaryExpr x && b instanceof UnaryExpr y) {
            return x.op().symbol().equals(y.op().symbol()) && equal(x.operand(), y.operand());
        }
        if (a instanceof BinaryExpr x && b instanceof BinaryExpr y) {
            return x.op().symbol().equals(y.op().symbol())
                    && equal(x.left(), y.left())
                    && equal(x.right(), y.right());
        }
        return false;
    }
}
