package bytebeat.sema;

import bytebeat.ast.expr.*;
import bytebeat.simplify.Simplifier;

import java.util.List;
import java.util.Optional;

/**
 * Conservative detector for undefined behavior that is certain regardless of
 * variable values. Children are checked before their parent, left before right;
 * only the condition of a ternary is checked.
 */
public final class UbChecker {
    /** Left shifts by more than this many bits are flagged; exactly this many is not. */
    public static final int MAX_SHIFT = 32;

    private final Simplifier simplifier = new Simplifier();

    public Optional<UbInfo> check(Expr e) {
        if (e instanceof Value) return Optional.empty();
        if (e instanceof UnaryExpr u) return check(u.operand());
        if (e instanceof BinaryExpr b) {
            return check(b.left())
                    .or(() -> check(b.right()))
                    .or(() -> checkNode(b));
        }
        if (e instanceof AssignExpr a) return check(a.value());
        // either branch may never run
        if (e instanceof TernaryExpr t) return check(t.condition());
        if (e instanceof ExprList l) return checkAll(l.exprs());
        if (e instanceof FunctionCall f) return checkAll(f.args());
        throw new IllegalStateException("Unknown expression: " + e);
    }

    private Optional<UbInfo> checkAll(List<Expr> exprs) {
        for (Expr e : exprs) {
            Optional<UbInfo> found = check(e);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private Optional<UbInfo> checkNode(BinaryExpr b) {
        Literal right = constantValue(b.right());
        if (right == null) return Optional.empty();

        if (b.op() == BinaryExpr.Operator.DIV && right.isNumber(0)) {
            return Optional.of(new UbInfo(b, UbInfo.Kind.DIVIDE_BY_ZERO));
        }
        if (b.op() == BinaryExpr.Operator.SHL && exceeds(right, MAX_SHIFT)) {
            return Optional.of(new UbInfo(b, UbInfo.Kind.OVERWIDE_LEFT_SHIFT));
        }
        return Optional.empty();
    }

    // null when the operand does not fold to a literal, including ill-typed operands
    private Literal constantValue(Expr e) {
        return simplifier.simplify(e) instanceof Value v ? v.literal() : null;
    }

    private static boolean exceeds(Literal literal, int limit) {
        if (literal instanceof IntLiteral i) return i.value() > limit;
        if (literal instanceof FloatLiteral f) return f.value() > limit;
        return false;
    }
}
